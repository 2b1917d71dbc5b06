/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.error.ErrorContext;
import io.toolgate.error.ErrorKind;
import io.toolgate.error.McpErrorHandler;
import io.toolgate.spec.McpError;
import io.toolgate.spec.McpSchema.ErrorCodes;
import io.toolgate.spec.McpServerTransport;
import io.toolgate.spec.TransportKind;
import io.toolgate.util.Assert;
import io.toolgate.util.Utils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Owns the live sessions of a server: admission, the session state machine, periodic
 * expiry and cleanup sweeps, and graceful shutdown.
 * <p>
 * Timers are armed by {@link #start()}; constructing a manager has no side effects.
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	public static final String REASON_SESSION_EXPIRED = "session_expired";

	public static final String REASON_CLEANUP = "cleanup";

	public static final String REASON_SERVER_SHUTDOWN = "server_shutdown";

	private final SessionManagerConfig config;

	private final McpErrorHandler errorHandler;

	private final Authenticator authenticator;

	private final LongSupplier currentTimeMillisSupplier;

	private final ConcurrentHashMap<String, ClientSession> sessions = new ConcurrentHashMap<>();

	private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

	private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

	private final Object statsLock = new Object();

	private long totalConnections;

	private long totalDisconnections;

	private long lastCleanup;

	private volatile ConnectionStats stats = ConnectionStats.EMPTY;

	private ScheduledExecutorService scheduler;

	private ScheduledFuture<?> cleanupTask;

	private ScheduledFuture<?> healthCheckTask;

	public SessionManager(SessionManagerConfig config, McpErrorHandler errorHandler) {
		this(config, errorHandler, Authenticator.ANONYMOUS, System::currentTimeMillis);
	}

	public SessionManager(SessionManagerConfig config, McpErrorHandler errorHandler, Authenticator authenticator,
			LongSupplier currentTimeMillisSupplier) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(errorHandler, "errorHandler must not be null");
		Assert.notNull(authenticator, "authenticator must not be null");
		Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
		this.config = config;
		this.errorHandler = errorHandler;
		this.authenticator = authenticator;
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
	}

	public void addListener(SessionListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(listener);
	}

	public void removeListener(SessionListener listener) {
		this.listeners.remove(listener);
	}

	/**
	 * Arms the health check and, when enabled, the cleanup sweep.
	 */
	public synchronized void start() {
		if (this.scheduler != null || this.shuttingDown.get()) {
			return;
		}
		this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "toolgate-session-sweeper");
			thread.setDaemon(true);
			return thread;
		});
		long healthMillis = config.healthCheckInterval().toMillis();
		this.healthCheckTask = scheduler.scheduleAtFixedRate(() -> runSweep("health check", performHealthCheck()),
				healthMillis, healthMillis, TimeUnit.MILLISECONDS);
		if (config.autoCleanup()) {
			long cleanupMillis = config.cleanupInterval().toMillis();
			this.cleanupTask = scheduler.scheduleAtFixedRate(() -> runSweep("cleanup", cleanup()), cleanupMillis,
					cleanupMillis, TimeUnit.MILLISECONDS);
		}
		logger.info("Session manager started (maxConnections: {}, healthCheckInterval: {}, cleanupInterval: {})",
				config.maxConnections(), config.healthCheckInterval(),
				config.autoCleanup() ? config.cleanupInterval() : "disabled");
	}

	private void runSweep(String name, Mono<Integer> sweep) {
		try {
			sweep.block();
		}
		catch (Exception e) {
			logger.error("Session {} sweep failed", name, e);
		}
	}

	/**
	 * Admits a new client.
	 * @param clientId identifier of the client, used in the session id
	 * @param transport the connection the session is bound to, may be {@code null} for
	 * in-process clients
	 * @param transportKind kind of the connection
	 * @return the new session in {@link SessionState#CONNECTING}
	 * @throws McpError INTERNAL_ERROR while shutting down, RATE_LIMIT_EXCEEDED at capacity
	 */
	public ClientSession createSession(String clientId, @Nullable McpServerTransport transport,
			TransportKind transportKind) {
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.notNull(transportKind, "transportKind must not be null");

		ClientSession session;
		synchronized (this.sessions) {
			if (this.shuttingDown.get()) {
				throw errorHandler.createError(ErrorCodes.INTERNAL_ERROR, "Server is shutting down",
						ErrorContext.builder().operation("createSession").detail("clientId", clientId).build());
			}
			if (this.sessions.size() >= config.maxConnections()) {
				throw errorHandler.handleRateLimitError("Maximum connections exceeded",
						ErrorContext.builder()
							.operation("createSession")
							.detail("clientId", clientId)
							.detail("currentConnections", this.sessions.size())
							.detail("maxConnections", config.maxConnections())
							.build());
			}
			long now = currentTimeMillisSupplier.getAsLong();
			String id;
			do {
				id = generateSessionId(clientId, now);
			}
			while (this.sessions.containsKey(id));
			session = new ClientSession(id, clientId, transport, transportKind, now, config.defaultTimeout());
			this.sessions.put(id, session);
		}

		synchronized (statsLock) {
			totalConnections++;
		}
		recomputeStats();
		logger.info("Session created: {} (client: {}, transport: {})", session.getId(), clientId,
				transportKind.id());
		notifyListeners(listener -> listener.onCreated(session));
		return session;
	}

	private static String generateSessionId(String clientId, long now) {
		String random = Long.toString(ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE, 36);
		return "session_" + clientId + "_" + now + "_" + random.substring(0, Math.min(9, random.length()));
	}

	/**
	 * Completes the handshake of a session.
	 * @param sessionId the session to authenticate
	 * @param authData credentials presented by the client, may be {@code null}
	 * @return the authenticated session
	 * @throws McpError SESSION_EXPIRED for unknown ids, AUTHENTICATION_FAILED when the
	 * session is not connecting or the credentials are rejected
	 */
	public ClientSession authenticateSession(String sessionId, @Nullable Map<String, Object> authData) {
		ErrorContext context = ErrorContext.builder().sessionId(sessionId).operation("authenticateSession").build();
		ClientSession session = this.sessions.get(sessionId);
		if (session == null) {
			throw errorHandler.handleSessionError(sessionId, "Session not found: " + sessionId, context);
		}
		if (session.getState() != SessionState.CONNECTING) {
			throw errorHandler.handleAuthenticationError(ErrorKind.AUTHENTICATION_FAILED,
					"Session is not awaiting authentication (state: " + session.getState() + ")", context);
		}

		UserContext user;
		try {
			user = authenticator.authenticate(session, authData == null ? Map.of() : authData);
		}
		catch (McpError e) {
			throw e;
		}
		catch (RuntimeException e) {
			throw errorHandler.handleAuthenticationError(ErrorKind.AUTHENTICATION_FAILED,
					"Authentication failed: " + Utils.describe(e), context);
		}

		if (!session.transitionTo(SessionState.AUTHENTICATED)) {
			throw errorHandler.handleAuthenticationError(ErrorKind.AUTHENTICATION_FAILED,
					"Session is not awaiting authentication (state: " + session.getState() + ")", context);
		}
		session.setUser(user);
		session.touch(currentTimeMillisSupplier.getAsLong());
		logger.info("Session authenticated: {} (user: {})", sessionId, user != null ? user.userId() : "anonymous");
		notifyListeners(listener -> listener.onAuthenticated(session));
		return session;
	}

	/**
	 * Disconnects a session and releases its transport. Unknown ids are ignored; when two
	 * callers disconnect the same session only the first runs the sequence.
	 * @param sessionId the session to disconnect
	 * @param reason reason reported to listeners
	 * @return a {@link Mono} that completes once the session has been removed
	 */
	public Mono<Void> disconnectSession(String sessionId, String reason) {
		return Mono.defer(() -> {
			ClientSession session = this.sessions.get(sessionId);
			if (session == null) {
				logger.debug("Ignoring disconnect of unknown session {} ({})", sessionId, reason);
				return Mono.empty();
			}
			if (!session.transitionTo(SessionState.DISCONNECTING)) {
				logger.debug("Session {} is already disconnecting", sessionId);
				return Mono.empty();
			}
			McpServerTransport transport = session.getTransport();
			Mono<Void> release = transport == null ? Mono.empty() : Mono.defer(transport::closeGracefully);
			return release.onErrorResume(e -> {
				logger.warn("Failed to close transport of session {}: {}", sessionId, Utils.describe(e));
				return Mono.empty();
			}).then(Mono.fromRunnable(() -> completeDisconnect(session, reason)));
		});
	}

	private void completeDisconnect(ClientSession session, String reason) {
		session.clear();
		this.sessions.remove(session.getId(), session);
		session.transitionTo(SessionState.DISCONNECTED);
		synchronized (statsLock) {
			totalDisconnections++;
		}
		recomputeStats();
		logger.info("Session disconnected: {} (reason: {})", session.getId(), reason);
		notifyListeners(listener -> listener.onDisconnected(session, reason));
	}

	/**
	 * Records one processed message for a session.
	 */
	public void touch(ClientSession session, long processingMillis) {
		session.recordRequest(currentTimeMillisSupplier.getAsLong(), processingMillis);
	}

	public void recordToolCall(ClientSession session) {
		session.recordToolCall();
	}

	/**
	 * Sets or, for a {@code null} value, removes a metadata entry of a live session.
	 */
	public void updateMetadata(ClientSession session, String key, @Nullable Object value) {
		if (session.isLive()) {
			session.putMetadata(key, value);
		}
	}

	/**
	 * Restricts the tools a session may list and call. An empty set lifts the
	 * restriction.
	 */
	public void setVisibleTools(ClientSession session, Set<String> toolNames) {
		Assert.notNull(toolNames, "toolNames must not be null");
		if (session.isLive()) {
			session.setVisibleTools(toolNames);
		}
	}

	@Nullable
	public ClientSession getSession(String sessionId) {
		return this.sessions.get(sessionId);
	}

	public Collection<ClientSession> getActiveSessions() {
		return List.copyOf(this.sessions.values());
	}

	public int getSessionCount() {
		return this.sessions.size();
	}

	public ConnectionStats getStats() {
		return this.stats;
	}

	public SessionManagerConfig getConfig() {
		return config;
	}

	public boolean isShuttingDown() {
		return shuttingDown.get();
	}

	/**
	 * Disconnects every session whose inactivity timeout has elapsed.
	 * @return the number of sessions removed
	 */
	public Mono<Integer> performHealthCheck() {
		return Mono.defer(() -> {
			long now = currentTimeMillisSupplier.getAsLong();
			List<ClientSession> expired = this.sessions.values()
				.stream()
				.filter(session -> session.isLive() && session.isExpired(now))
				.toList();
			if (expired.isEmpty()) {
				return Mono.just(0);
			}
			logger.info("Health check found {} expired session(s)", expired.size());
			return Flux.fromIterable(expired).concatMap(session -> {
				notifyListeners(listener -> listener.onExpired(session));
				return disconnectSession(session.getId(), REASON_SESSION_EXPIRED).thenReturn(1);
			}).reduce(0, Integer::sum);
		});
	}

	/**
	 * Disconnects sessions that are expired or still handshaking after the handshake
	 * timeout.
	 * @return the number of sessions removed
	 */
	public Mono<Integer> cleanup() {
		return Mono.defer(() -> {
			long now = currentTimeMillisSupplier.getAsLong();
			long handshakeMillis = config.handshakeTimeout().toMillis();
			List<ClientSession> stale = this.sessions.values()
				.stream()
				.filter(session -> session.isLive() && (session.isExpired(now)
						|| (session.getState() == SessionState.CONNECTING
								&& now - session.getCreatedAt() > handshakeMillis)))
				.toList();
			return Flux.fromIterable(stale)
				.concatMap(session -> disconnectSession(session.getId(), REASON_CLEANUP).thenReturn(1))
				.reduce(0, Integer::sum)
				.doOnNext(removed -> {
					synchronized (statsLock) {
						lastCleanup = now;
					}
					recomputeStats();
					if (removed > 0) {
						logger.info("Cleanup removed {} session(s)", removed);
					}
					notifyListeners(listener -> listener.onCleanupCompleted(removed));
				});
		});
	}

	/**
	 * Stops the sweeps and disconnects every live session. Subsequent calls complete
	 * immediately.
	 * @return a {@link Mono} that completes when all sessions have been drained
	 */
	public Mono<Void> shutdown() {
		return Mono.defer(() -> {
			List<String> ids;
			// Flag and snapshot under the same lock createSession admits under
			synchronized (this.sessions) {
				if (!this.shuttingDown.compareAndSet(false, true)) {
					logger.debug("Session manager shutdown already in progress");
					return Mono.empty();
				}
				ids = new ArrayList<>(this.sessions.keySet());
			}
			ScheduledExecutorService executor = cancelTimers();
			logger.info("Shutting down session manager, disconnecting {} session(s)", ids.size());

			ScheduledFuture<?> warning = executor.schedule(
					() -> logger.warn("Session drain exceeded shutdown timeout of {}", config.shutdownTimeout()),
					config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);

			return Flux.fromIterable(ids)
				.flatMap(id -> disconnectSession(id, REASON_SERVER_SHUTDOWN).onErrorResume(e -> {
					logger.error("Failed to disconnect session {} during shutdown: {}", id, Utils.describe(e));
					return Mono.empty();
				}))
				.then()
				.doFinally(signal -> {
					warning.cancel(false);
					executor.shutdownNow();
					logger.info("Session manager shut down");
				});
		});
	}

	private synchronized ScheduledExecutorService cancelTimers() {
		if (this.cleanupTask != null) {
			this.cleanupTask.cancel(false);
		}
		if (this.healthCheckTask != null) {
			this.healthCheckTask.cancel(false);
		}
		if (this.scheduler == null) {
			this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
				Thread thread = new Thread(runnable, "toolgate-session-shutdown");
				thread.setDaemon(true);
				return thread;
			});
		}
		return this.scheduler;
	}

	private void recomputeStats() {
		long now = currentTimeMillisSupplier.getAsLong();
		Map<String, Integer> byTransport = new HashMap<>();
		long durationSum = 0;
		int count = 0;
		for (ClientSession session : this.sessions.values()) {
			byTransport.merge(session.getTransportKind().id(), 1, Integer::sum);
			durationSum += now - session.getCreatedAt();
			count++;
		}
		synchronized (statsLock) {
			this.stats = new ConnectionStats(count, totalConnections, totalDisconnections, Map.copyOf(byTransport),
					count == 0 ? 0 : (double) durationSum / count, lastCleanup);
		}
	}

	private void notifyListeners(Consumer<SessionListener> event) {
		for (SessionListener listener : this.listeners) {
			try {
				event.accept(listener);
			}
			catch (Exception e) {
				logger.error("Session listener failed", e);
			}
		}
	}

}
