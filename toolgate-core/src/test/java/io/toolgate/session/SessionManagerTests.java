/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import io.toolgate.error.McpErrorHandler;
import io.toolgate.spec.McpError;
import io.toolgate.spec.McpSchema.ErrorCodes;
import io.toolgate.spec.McpServerTransport;
import io.toolgate.spec.TransportKind;

class SessionManagerTests {

	private final AtomicLong now = new AtomicLong(1_700_000_000_000L);

	private McpErrorHandler errorHandler;

	private SessionManager manager;

	private SessionListener listener;

	@BeforeEach
	void setUp() {
		errorHandler = new McpErrorHandler();
		manager = newManager(SessionManagerConfig.builder().maxConnections(3).build(), Authenticator.ANONYMOUS);
	}

	@AfterEach
	void tearDown() {
		manager.shutdown().block(Duration.ofSeconds(5));
	}

	private SessionManager newManager(SessionManagerConfig config, Authenticator authenticator) {
		SessionManager sessionManager = new SessionManager(config, errorHandler, authenticator, now::get);
		listener = mock(SessionListener.class);
		sessionManager.addListener(listener);
		return sessionManager;
	}

	private static McpServerTransport transport() {
		McpServerTransport transport = mock(McpServerTransport.class);
		when(transport.kind()).thenReturn(TransportKind.STDIO);
		when(transport.closeGracefully()).thenReturn(Mono.empty());
		return transport;
	}

	@Test
	void createSessionStartsConnecting() {
		ClientSession session = manager.createSession("client-1", transport(), TransportKind.STDIO);

		assertThat(session.getId()).matches("session_client-1_1700000000000_[0-9a-z]+");
		assertThat(session.getState()).isEqualTo(SessionState.CONNECTING);
		assertThat(session.getTimeout()).isEqualTo(Duration.ofMinutes(5));
		assertThat(manager.getSession(session.getId())).isSameAs(session);
		assertThat(manager.getStats().activeConnections()).isEqualTo(1);
		assertThat(manager.getStats().connectionsByTransport()).containsEntry("stdio", 1);
		verify(listener).onCreated(session);
	}

	@Test
	void sessionIdsAreUnique() {
		ClientSession first = manager.createSession("client", null, TransportKind.TCP);
		ClientSession second = manager.createSession("client", null, TransportKind.TCP);

		assertThat(first.getId()).isNotEqualTo(second.getId());
	}

	@Test
	void createSessionAtCapacityIsRateLimited() {
		for (int i = 0; i < 3; i++) {
			manager.createSession("client-" + i, null, TransportKind.TCP);
		}

		assertThatThrownBy(() -> manager.createSession("client-x", null, TransportKind.TCP))
			.isInstanceOfSatisfying(McpError.class, e -> {
				assertThat(e.getCode()).isEqualTo(ErrorCodes.RATE_LIMIT_EXCEEDED);
				assertThat(e.getJsonRpcError().data().toString()).contains("currentConnections=3",
						"maxConnections=3", "wait_and_retry");
			});
		assertThat(manager.getSessionCount()).isEqualTo(3);
	}

	@Test
	void authenticateMovesToAuthenticated() {
		UserContext user = new UserContext("alice", Set.of("repo:read"), Set.of(), PermissionLevel.READ);
		SessionManager authenticating = newManager(SessionManagerConfig.defaults(),
				(session, authData) -> "secret".equals(authData.get("token")) ? user : null);
		ClientSession session = authenticating.createSession("client", null, TransportKind.STDIO);
		now.addAndGet(1000);

		authenticating.authenticateSession(session.getId(), Map.of("token", "secret"));

		assertThat(session.getState()).isEqualTo(SessionState.AUTHENTICATED);
		assertThat(session.getUser()).isEqualTo(user);
		assertThat(session.getLastActivity()).isEqualTo(now.get());
		verify(listener).onAuthenticated(session);
		authenticating.shutdown().block();
	}

	@Test
	void authenticateTwiceFailsAndKeepsState() {
		ClientSession session = manager.createSession("client", null, TransportKind.STDIO);
		manager.authenticateSession(session.getId(), null);

		assertThatThrownBy(() -> manager.authenticateSession(session.getId(), null))
			.isInstanceOfSatisfying(McpError.class,
					e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.AUTHENTICATION_FAILED));
		assertThat(session.getState()).isEqualTo(SessionState.AUTHENTICATED);
	}

	@Test
	void authenticateUnknownSessionIsSessionExpired() {
		assertThatThrownBy(() -> manager.authenticateSession("session_missing", Map.of()))
			.isInstanceOfSatisfying(McpError.class,
					e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.SESSION_EXPIRED));
	}

	@Test
	void rejectedCredentialsAreAuthenticationFailed() {
		SessionManager strict = newManager(SessionManagerConfig.defaults(), (session, authData) -> {
			throw new IllegalArgumentException("invalid token");
		});
		ClientSession session = strict.createSession("client", null, TransportKind.STDIO);

		assertThatThrownBy(() -> strict.authenticateSession(session.getId(), Map.of("token", "nope")))
			.isInstanceOfSatisfying(McpError.class, e -> {
				assertThat(e.getCode()).isEqualTo(ErrorCodes.AUTHENTICATION_FAILED);
				assertThat(e.getMessage()).isEqualTo("Authentication failed: invalid token");
			});
		assertThat(session.getState()).isEqualTo(SessionState.CONNECTING);
		strict.shutdown().block();
	}

	@Test
	void disconnectReleasesTransportAndClearsState() {
		McpServerTransport transport = transport();
		ClientSession session = manager.createSession("client", transport, TransportKind.STDIO);
		manager.updateMetadata(session, "initialized", true);
		manager.setVisibleTools(session, Set.of("get_status"));

		StepVerifier.create(manager.disconnectSession(session.getId(), "client_disconnected")).verifyComplete();

		assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
		assertThat(session.getMetadata()).isEmpty();
		assertThat(session.getVisibleTools()).isEmpty();
		assertThat(manager.getSession(session.getId())).isNull();
		assertThat(manager.getStats().totalDisconnections()).isEqualTo(1);
		verify(transport).closeGracefully();
		verify(listener).onDisconnected(session, "client_disconnected");
	}

	@Test
	void disconnectUnknownSessionIsNoOp() {
		StepVerifier.create(manager.disconnectSession("session_unknown", "test")).verifyComplete();

		verify(listener, never()).onDisconnected(any(), anyString());
	}

	@Test
	void transportCloseFailureIsNotPropagated() {
		McpServerTransport transport = mock(McpServerTransport.class);
		when(transport.closeGracefully()).thenReturn(Mono.error(new IllegalStateException("socket closed")));
		ClientSession session = manager.createSession("client", transport, TransportKind.TCP);

		StepVerifier.create(manager.disconnectSession(session.getId(), "test")).verifyComplete();

		assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
		assertThat(manager.getSessionCount()).isZero();
	}

	@Test
	void concurrentDisconnectsRunOnce() {
		ClientSession session = manager.createSession("client", transport(), TransportKind.STDIO);

		StepVerifier
			.create(Mono.when(manager.disconnectSession(session.getId(), "first"),
					manager.disconnectSession(session.getId(), "second")))
			.verifyComplete();

		verify(listener, times(1)).onDisconnected(eq(session), anyString());
		assertThat(manager.getStats().totalDisconnections()).isEqualTo(1);
	}

	@Test
	void healthCheckRemovesExpiredSessions() {
		ClientSession stale = manager.createSession("stale", null, TransportKind.STDIO);
		now.addAndGet(Duration.ofMinutes(4).toMillis());
		ClientSession fresh = manager.createSession("fresh", null, TransportKind.STDIO);
		now.addAndGet(Duration.ofMinutes(1).toMillis() + 1);

		StepVerifier.create(manager.performHealthCheck()).expectNext(1).verifyComplete();

		assertThat(manager.getSession(stale.getId())).isNull();
		assertThat(manager.getSession(fresh.getId())).isNotNull();
		verify(listener).onExpired(stale);
		verify(listener).onDisconnected(stale, "session_expired");
	}

	@Test
	void activityPostponesExpiry() {
		ClientSession session = manager.createSession("client", null, TransportKind.STDIO);
		now.addAndGet(Duration.ofMinutes(4).toMillis());
		manager.touch(session, 12);
		now.addAndGet(Duration.ofMinutes(4).toMillis());

		StepVerifier.create(manager.performHealthCheck()).expectNext(0).verifyComplete();

		SessionStats stats = session.getStats(now.get());
		assertThat(stats.requestsProcessed()).isEqualTo(1);
		assertThat(stats.averageProcessingTime()).isEqualTo(12.0);
	}

	@Test
	void cleanupRemovesStaleHandshakes() {
		ClientSession handshaking = manager.createSession("handshaking", null, TransportKind.STDIO);
		ClientSession authenticated = manager.createSession("authenticated", null, TransportKind.STDIO);
		manager.authenticateSession(authenticated.getId(), null);
		now.addAndGet(Duration.ofSeconds(61).toMillis());

		StepVerifier.create(manager.cleanup()).expectNext(1).verifyComplete();

		assertThat(manager.getSession(handshaking.getId())).isNull();
		assertThat(manager.getSession(authenticated.getId())).isNotNull();
		assertThat(manager.getStats().lastCleanup()).isEqualTo(now.get());
		verify(listener).onDisconnected(handshaking, "cleanup");
		verify(listener).onCleanupCompleted(1);
	}

	@Test
	void shutdownDisconnectsAllAndIsIdempotent() {
		ClientSession first = manager.createSession("first", transport(), TransportKind.STDIO);
		ClientSession second = manager.createSession("second", transport(), TransportKind.TCP);

		StepVerifier.create(manager.shutdown()).verifyComplete();
		assertThatCode(() -> manager.shutdown().block()).doesNotThrowAnyException();

		assertThat(manager.getSessionCount()).isZero();
		verify(listener).onDisconnected(first, "server_shutdown");
		verify(listener).onDisconnected(second, "server_shutdown");
		verify(listener, times(2)).onDisconnected(any(), anyString());
	}

	@Test
	void shutdownDrainsSessionAdmittedWhileItStarts() throws Exception {
		CountDownLatch admitting = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		AtomicBoolean pauseOnce = new AtomicBoolean(true);
		SessionManager racing = new SessionManager(SessionManagerConfig.builder().build(), errorHandler,
				Authenticator.ANONYMOUS, () -> {
					// Holds the creator inside the admission section
					if (pauseOnce.compareAndSet(true, false)) {
						admitting.countDown();
						try {
							release.await(5, TimeUnit.SECONDS);
						}
						catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						}
					}
					return now.get();
				});

		CompletableFuture<ClientSession> created = CompletableFuture
			.supplyAsync(() -> racing.createSession("late", null, TransportKind.STDIO));
		assertThat(admitting.await(5, TimeUnit.SECONDS)).isTrue();

		Thread stopper = new Thread(() -> racing.shutdown().block(Duration.ofSeconds(5)), "session-shutdown");
		stopper.start();
		await().atMost(Duration.ofSeconds(5)).until(() -> stopper.getState() == Thread.State.BLOCKED);
		release.countDown();

		ClientSession session = created.get(5, TimeUnit.SECONDS);
		stopper.join(5000);

		assertThat(stopper.isAlive()).isFalse();
		assertThat(racing.getSessionCount()).isZero();
		assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
	}

	@Test
	void createSessionAfterShutdownIsRejected() {
		manager.shutdown().block();

		assertThatThrownBy(() -> manager.createSession("late", null, TransportKind.STDIO))
			.isInstanceOfSatisfying(McpError.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.INTERNAL_ERROR));
	}

	@Test
	void timersSweepPeriodically() {
		SessionManager swept = new SessionManager(
				SessionManagerConfig.builder()
					.defaultTimeout(Duration.ofMillis(50))
					.healthCheckInterval(Duration.ofMillis(50))
					.cleanupInterval(Duration.ofMillis(50))
					.build(),
				errorHandler, Authenticator.ANONYMOUS, System::currentTimeMillis);
		swept.createSession("client", null, TransportKind.STDIO);

		swept.start();

		await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(swept.getSessionCount()).isZero());
		swept.shutdown().block();
	}

	@Test
	void listenerFailuresDoNotBreakLifecycle() {
		manager.addListener(new SessionListener() {
			@Override
			public void onCreated(ClientSession session) {
				throw new IllegalStateException("listener bug");
			}
		});

		ClientSession session = manager.createSession("client", null, TransportKind.STDIO);

		assertThat(manager.getSession(session.getId())).isNotNull();
	}

}
