/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.error.McpErrorHandler;
import io.toolgate.json.McpJsonMapper;
import io.toolgate.server.tools.DiagnosticTools;
import io.toolgate.server.transport.ConnectionHandler;
import io.toolgate.server.transport.TransportProvider;
import io.toolgate.session.Authenticator;
import io.toolgate.session.SessionManager;
import io.toolgate.tools.ToolRegistry;
import io.toolgate.tools.ToolSpecification;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Wires the error handler, session manager, tool registry and protocol router to a
 * {@link TransportProvider}.
 * <p>
 * The server stops when {@link #stop()} is called, when a client sends
 * {@code shutdown}, or when the transport terminates (for stdio, when the input ends).
 *
 * <pre>{@code
 * McpToolServer server = McpToolServer.builder(new StdioTransportProvider())
 *     .config(ServerConfig.builder().maxClients(10).build())
 *     .tool(myToolSpecification)
 *     .build();
 * server.start();
 * server.awaitTermination();
 * }</pre>
 */
public class McpToolServer {

	private static final Logger logger = LoggerFactory.getLogger(McpToolServer.class);

	private final ServerConfig config;

	private final TransportProvider transportProvider;

	private final McpErrorHandler errorHandler;

	private final SessionManager sessionManager;

	private final ToolRegistry toolRegistry;

	private final ProtocolRouter router;

	private final ConnectionHandler connectionHandler;

	private final AtomicBoolean started = new AtomicBoolean();

	private final AtomicBoolean stopping = new AtomicBoolean();

	private final Sinks.Empty<Void> terminated = Sinks.empty();

	private volatile long startedAt;

	McpToolServer(ServerConfig config, TransportProvider transportProvider, McpJsonMapper jsonMapper,
			Authenticator authenticator, List<ToolSpecification> tools) {
		this.config = config;
		this.transportProvider = transportProvider;
		this.errorHandler = new McpErrorHandler();
		this.sessionManager = new SessionManager(config.sessions(), this.errorHandler, authenticator,
				System::currentTimeMillis);
		this.toolRegistry = new ToolRegistry(config.tools(), this.errorHandler);
		this.router = new ProtocolRouter(config.router(), this.sessionManager, this.toolRegistry, this.errorHandler,
				jsonMapper, this::stop);

		if (config.builtInTools()) {
			this.toolRegistry.registerTool(DiagnosticTools.serverStatus(this));
			this.toolRegistry.registerTool(DiagnosticTools.echoMessage());
		}
		tools.forEach(this.toolRegistry::registerTool);
		this.connectionHandler = new ConnectionHandler(this.sessionManager, this.router, jsonMapper);
	}

	public static Builder builder(TransportProvider transportProvider) {
		return new Builder(transportProvider);
	}

	/**
	 * Starts the session timers and the transport.
	 * @throws IOException if the transport cannot open its channel
	 */
	public void start() throws IOException {
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Server already started");
		}
		this.startedAt = System.currentTimeMillis();
		this.sessionManager.start();
		try {
			this.transportProvider.start(this.connectionHandler);
		}
		catch (IOException | RuntimeException e) {
			this.sessionManager.shutdown().block(this.config.sessions().shutdownTimeout());
			this.terminated.tryEmitEmpty();
			throw e;
		}
		this.transportProvider.onTermination().subscribe(null, null, () -> stop().subscribe());
		logger.info("{} {} started on {} with {} tool(s)", this.config.router().serverInfo().name(),
				this.config.router().serverInfo().version(), this.transportProvider.kind().id(),
				this.toolRegistry.getToolCount());
	}

	/**
	 * Disconnects every session and closes the transport. Calling it again returns the
	 * pending or completed stop.
	 */
	public Mono<Void> stop() {
		return Mono.defer(() -> {
			if (!this.stopping.compareAndSet(false, true)) {
				return this.terminated.asMono();
			}
			logger.info("Stopping server");
			return this.sessionManager.shutdown()
				.onErrorResume(e -> {
					logger.warn("Session shutdown failed: {}", e.getMessage());
					return Mono.empty();
				})
				.then(this.transportProvider.closeGracefully())
				.onErrorResume(e -> {
					logger.warn("Transport close failed: {}", e.getMessage());
					return Mono.empty();
				})
				.doFinally(signal -> {
					logger.info("Server stopped");
					this.terminated.tryEmitEmpty();
				});
		});
	}

	/**
	 * Blocks until the server has stopped.
	 */
	public void awaitTermination() {
		this.terminated.asMono().block();
	}

	/**
	 * Blocks until the server has stopped or the timeout elapses.
	 * @return {@code true} if the server stopped in time
	 */
	public boolean awaitTermination(Duration timeout) {
		return this.terminated.asMono().then(Mono.just(true)).timeout(timeout, Mono.just(false)).block();
	}

	public Mono<Void> onTermination() {
		return this.terminated.asMono();
	}

	public boolean isRunning() {
		return this.started.get() && !this.stopping.get();
	}

	public long getUptime() {
		return this.startedAt == 0 ? 0 : System.currentTimeMillis() - this.startedAt;
	}

	public ServerConfig getConfig() {
		return this.config;
	}

	public TransportProvider getTransportProvider() {
		return this.transportProvider;
	}

	public McpErrorHandler getErrorHandler() {
		return this.errorHandler;
	}

	public SessionManager getSessionManager() {
		return this.sessionManager;
	}

	public ToolRegistry getToolRegistry() {
		return this.toolRegistry;
	}

	public ProtocolRouter getRouter() {
		return this.router;
	}

	public static class Builder {

		private final TransportProvider transportProvider;

		private ServerConfig config = ServerConfig.defaults();

		private McpJsonMapper jsonMapper;

		private Authenticator authenticator = Authenticator.ANONYMOUS;

		private final List<ToolSpecification> tools = new ArrayList<>();

		private Builder(TransportProvider transportProvider) {
			Assert.notNull(transportProvider, "Transport provider must not be null");
			this.transportProvider = transportProvider;
		}

		public Builder config(ServerConfig config) {
			Assert.notNull(config, "config must not be null");
			this.config = config;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		/**
		 * Sets how the credentials a client sends with {@code initialize} are resolved
		 * to a user. Defaults to {@link Authenticator#ANONYMOUS}.
		 * @param authenticator the authenticator
		 * @return this builder
		 */
		public Builder authenticator(Authenticator authenticator) {
			Assert.notNull(authenticator, "authenticator must not be null");
			this.authenticator = authenticator;
			return this;
		}

		public Builder tool(ToolSpecification tool) {
			Assert.notNull(tool, "tool must not be null");
			this.tools.add(tool);
			return this;
		}

		public Builder tools(List<ToolSpecification> tools) {
			Assert.notNull(tools, "tools must not be null");
			tools.forEach(this::tool);
			return this;
		}

		public McpToolServer build() {
			return new McpToolServer(this.config, this.transportProvider,
					this.jsonMapper != null ? this.jsonMapper : McpJsonMapper.createDefault(), this.authenticator,
					List.copyOf(this.tools));
		}

	}

}
