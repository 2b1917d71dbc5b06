/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.transport;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.spec.TransportKind;
import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Listens on a TCP socket and serves every accepted connection on its own thread with
 * newline-delimited JSON framing.
 */
public class TcpTransportProvider implements TransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(TcpTransportProvider.class);

	private static final int BACKLOG = 50;

	private final String host;

	private final int port;

	private final Set<Socket> connections = ConcurrentHashMap.newKeySet();

	private final Sinks.Empty<Void> terminated = Sinks.empty();

	private volatile ServerSocket serverSocket;

	private volatile boolean running;

	private ExecutorService connectionExecutor;

	/**
	 * @param host the interface to bind
	 * @param port the port to listen on, {@code 0} picks a free port
	 */
	public TcpTransportProvider(String host, int port) {
		Assert.hasText(host, "host must not be empty");
		Assert.isTrue(port >= 0 && port <= 65535, "port must be between 0 and 65535");
		this.host = host;
		this.port = port;
	}

	@Override
	public TransportKind kind() {
		return TransportKind.TCP;
	}

	@Override
	public synchronized void start(ConnectionHandler handler) throws IOException {
		Assert.notNull(handler, "handler must not be null");
		if (this.serverSocket != null) {
			throw new IllegalStateException("TCP transport already started");
		}
		ServerSocket socket = new ServerSocket(this.port, BACKLOG, InetAddress.getByName(this.host));
		this.serverSocket = socket;
		this.connectionExecutor = Executors.newCachedThreadPool(new ConnectionThreadFactory());
		this.running = true;

		Thread acceptor = new Thread(() -> acceptLoop(socket, handler), "toolgate-tcp-accept");
		acceptor.setDaemon(true);
		acceptor.start();
		logger.info("Listening for MCP connections on {}:{}", this.host, socket.getLocalPort());
	}

	/**
	 * The port actually bound, useful when the provider was created with port 0.
	 * @return the local port, or {@code -1} before {@link #start}
	 */
	public int getLocalPort() {
		ServerSocket socket = this.serverSocket;
		return socket == null ? -1 : socket.getLocalPort();
	}

	private void acceptLoop(ServerSocket socket, ConnectionHandler handler) {
		try {
			while (this.running) {
				Socket connection = socket.accept();
				String clientId = clientId(connection);
				logger.debug("Connection received from {}", clientId);
				this.connections.add(connection);
				this.connectionExecutor.execute(() -> serve(connection, clientId, handler));
			}
		}
		catch (SocketException e) {
			if (this.running) {
				logger.error("Server socket failed", e);
			}
		}
		catch (IOException | RuntimeException e) {
			logger.error("Error accepting connections on port {}", socket.getLocalPort(), e);
		}
		finally {
			this.running = false;
			this.terminated.tryEmitEmpty();
		}
	}

	private void serve(Socket connection, String clientId, ConnectionHandler handler) {
		try {
			connection.setKeepAlive(true);
			handler.handle(clientId, connection.getInputStream(),
					new LineTransport(TransportKind.TCP, connection.getOutputStream(), connection));
		}
		catch (IOException | RuntimeException e) {
			logger.warn("Connection from {} failed: {}", clientId, e.getMessage());
		}
		finally {
			this.connections.remove(connection);
			try {
				connection.close();
			}
			catch (IOException e) {
				logger.debug("Failed to close connection from {}: {}", clientId, e.getMessage());
			}
		}
	}

	private static String clientId(Socket connection) {
		if (connection.getRemoteSocketAddress() instanceof InetSocketAddress remote) {
			return "tcp-" + remote.getAddress().getHostAddress() + ":" + remote.getPort();
		}
		return "tcp-" + connection.getRemoteSocketAddress();
	}

	@Override
	public Mono<Void> onTermination() {
		return this.terminated.asMono();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			this.running = false;
			ServerSocket socket = this.serverSocket;
			if (socket != null) {
				try {
					socket.close();
				}
				catch (IOException e) {
					logger.warn("Failed to close server socket: {}", e.getMessage());
				}
			}
			for (Socket connection : this.connections) {
				try {
					connection.close();
				}
				catch (IOException e) {
					logger.debug("Failed to close connection: {}", e.getMessage());
				}
			}
			if (this.connectionExecutor != null) {
				this.connectionExecutor.shutdown();
			}
			this.terminated.tryEmitEmpty();
			logger.info("TCP transport closed");
		});
	}

	private static final class ConnectionThreadFactory implements ThreadFactory {

		private final AtomicInteger count = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "toolgate-tcp-" + this.count.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
