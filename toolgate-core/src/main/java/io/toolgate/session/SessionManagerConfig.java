/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

import java.time.Duration;

import io.toolgate.util.Assert;

/**
 * Settings of a {@link SessionManager}. Defaults are applied once by the builder.
 *
 * @param maxConnections maximum number of live sessions
 * @param defaultTimeout inactivity timeout assigned to new sessions
 * @param cleanupInterval period of the cleanup sweep
 * @param healthCheckInterval period of the expiry sweep
 * @param shutdownTimeout drain duration after which shutdown logs a warning
 * @param handshakeTimeout how long a session may stay in
 * {@link SessionState#CONNECTING} before cleanup removes it
 * @param autoCleanup whether {@link SessionManager#start()} arms the cleanup sweep
 */
public record SessionManagerConfig(int maxConnections, Duration defaultTimeout, Duration cleanupInterval,
		Duration healthCheckInterval, Duration shutdownTimeout, Duration handshakeTimeout, boolean autoCleanup) {

	public SessionManagerConfig {
		Assert.isTrue(maxConnections > 0, "maxConnections must be positive");
		Assert.notNull(defaultTimeout, "defaultTimeout must not be null");
		Assert.notNull(cleanupInterval, "cleanupInterval must not be null");
		Assert.notNull(healthCheckInterval, "healthCheckInterval must not be null");
		Assert.notNull(shutdownTimeout, "shutdownTimeout must not be null");
		Assert.notNull(handshakeTimeout, "handshakeTimeout must not be null");
	}

	public static SessionManagerConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private int maxConnections = 100;

		private Duration defaultTimeout = Duration.ofMinutes(5);

		private Duration cleanupInterval = Duration.ofMinutes(1);

		private Duration healthCheckInterval = Duration.ofSeconds(30);

		private Duration shutdownTimeout = Duration.ofSeconds(30);

		private Duration handshakeTimeout = Duration.ofSeconds(60);

		private boolean autoCleanup = true;

		public Builder maxConnections(int maxConnections) {
			this.maxConnections = maxConnections;
			return this;
		}

		public Builder defaultTimeout(Duration defaultTimeout) {
			this.defaultTimeout = defaultTimeout;
			return this;
		}

		public Builder cleanupInterval(Duration cleanupInterval) {
			this.cleanupInterval = cleanupInterval;
			return this;
		}

		public Builder healthCheckInterval(Duration healthCheckInterval) {
			this.healthCheckInterval = healthCheckInterval;
			return this;
		}

		public Builder shutdownTimeout(Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		public Builder handshakeTimeout(Duration handshakeTimeout) {
			this.handshakeTimeout = handshakeTimeout;
			return this;
		}

		public Builder autoCleanup(boolean autoCleanup) {
			this.autoCleanup = autoCleanup;
			return this;
		}

		public SessionManagerConfig build() {
			return new SessionManagerConfig(maxConnections, defaultTimeout, cleanupInterval, healthCheckInterval,
					shutdownTimeout, handshakeTimeout, autoCleanup);
		}

	}

}
