/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.spec.TransportKind;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Serves a single client over standard input and output. The provider terminates when
 * the input stream ends.
 */
public class StdioTransportProvider implements TransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(StdioTransportProvider.class);

	public static final String CLIENT_ID = "stdio";

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final Sinks.Empty<Void> terminated = Sinks.empty();

	private final AtomicBoolean started = new AtomicBoolean();

	private volatile LineTransport transport;

	public StdioTransportProvider() {
		this(System.in, System.out);
	}

	public StdioTransportProvider(InputStream inputStream, OutputStream outputStream) {
		Assert.notNull(inputStream, "The InputStream can not be null");
		Assert.notNull(outputStream, "The OutputStream can not be null");
		this.inputStream = inputStream;
		this.outputStream = outputStream;
	}

	@Override
	public TransportKind kind() {
		return TransportKind.STDIO;
	}

	@Override
	public void start(ConnectionHandler handler) {
		Assert.notNull(handler, "handler must not be null");
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Stdio transport already started");
		}
		// stdout belongs to the client, the stream is flushed but never closed
		this.transport = new LineTransport(TransportKind.STDIO, this.outputStream, () -> {
		});
		Thread reader = new Thread(() -> {
			try {
				handler.handle(CLIENT_ID, this.inputStream, this.transport);
			}
			catch (RuntimeException e) {
				logger.error("Stdio connection failed", e);
			}
			finally {
				logger.info("Stdio input closed");
				this.terminated.tryEmitEmpty();
			}
		}, "toolgate-stdio");
		reader.setDaemon(true);
		reader.start();
		logger.info("Serving MCP over stdio");
	}

	@Override
	public Mono<Void> onTermination() {
		return this.terminated.asMono();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			LineTransport current = this.transport;
			Mono<Void> close = current == null ? Mono.empty() : current.closeGracefully();
			return close.doFinally(signal -> {
				try {
					this.inputStream.close();
				}
				catch (IOException e) {
					logger.debug("Failed to close stdin: {}", e.getMessage());
				}
				this.terminated.tryEmitEmpty();
			});
		});
	}

}
