/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.transport;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.spec.McpServerTransport;
import io.toolgate.spec.TransportKind;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Writes newline-delimited JSON messages to a byte stream. Each message is written as one
 * UTF-8 line and flushed. Writes are serialized so concurrent senders never interleave.
 */
public class LineTransport implements McpServerTransport {

	private static final Logger logger = LoggerFactory.getLogger(LineTransport.class);

	private final TransportKind kind;

	private final Writer writer;

	private final Closeable resource;

	private final AtomicBoolean closed = new AtomicBoolean();

	/**
	 * @param kind the channel kind reported to the session manager
	 * @param out the stream replies are written to
	 * @param resource released when the transport closes; the output stream itself is
	 * only flushed
	 */
	public LineTransport(TransportKind kind, OutputStream out, Closeable resource) {
		Assert.notNull(kind, "kind must not be null");
		Assert.notNull(out, "out must not be null");
		Assert.notNull(resource, "resource must not be null");
		this.kind = kind;
		this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
		this.resource = resource;
	}

	@Override
	public TransportKind kind() {
		return this.kind;
	}

	@Override
	public Mono<Void> sendMessage(String message) {
		return Mono.fromRunnable(() -> {
			if (this.closed.get()) {
				throw new TransportException("Transport is closed");
			}
			try {
				synchronized (this.writer) {
					this.writer.write(message);
					this.writer.write('\n');
					this.writer.flush();
				}
			}
			catch (IOException e) {
				throw new TransportException("Failed to write message", e);
			}
		});
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (!this.closed.compareAndSet(false, true)) {
				return;
			}
			logger.debug("Closing {} transport", this.kind.id());
			try {
				synchronized (this.writer) {
					this.writer.flush();
				}
			}
			catch (IOException e) {
				logger.debug("Failed to flush {} transport on close: {}", this.kind.id(), e.getMessage());
			}
			try {
				this.resource.close();
			}
			catch (IOException e) {
				throw new TransportException("Failed to close " + this.kind.id() + " transport", e);
			}
		});
	}

}
