/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import java.time.Duration;

import io.toolgate.spec.McpSchema;
import io.toolgate.util.Assert;

/**
 * Settings of a {@link ProtocolRouter}.
 *
 * @param serverInfo name and version reported during {@code initialize}
 * @param enableBatching whether JSON arrays of messages are accepted
 * @param enableNotifications whether notifications are dispatched
 * @param maxBatchSize largest accepted batch
 * @param maxInFlightMessages top-level messages that may be processing at once
 * @param shutdownDelay delay between acknowledging {@code shutdown} and stopping
 */
public record RouterConfig(McpSchema.Implementation serverInfo, boolean enableBatching, boolean enableNotifications,
		int maxBatchSize, int maxInFlightMessages, Duration shutdownDelay) {

	public static final McpSchema.Implementation DEFAULT_SERVER_INFO = new McpSchema.Implementation("toolgate",
			"0.1.0");

	public RouterConfig {
		Assert.notNull(serverInfo, "serverInfo must not be null");
		Assert.isTrue(maxBatchSize > 0, "maxBatchSize must be positive");
		Assert.isTrue(maxInFlightMessages > 0, "maxInFlightMessages must be positive");
		Assert.notNull(shutdownDelay, "shutdownDelay must not be null");
	}

	public static RouterConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private McpSchema.Implementation serverInfo = DEFAULT_SERVER_INFO;

		private boolean enableBatching = true;

		private boolean enableNotifications = true;

		private int maxBatchSize = 100;

		private int maxInFlightMessages = 1000;

		private Duration shutdownDelay = Duration.ofSeconds(1);

		public Builder serverInfo(String name, String version) {
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		public Builder enableBatching(boolean enableBatching) {
			this.enableBatching = enableBatching;
			return this;
		}

		public Builder enableNotifications(boolean enableNotifications) {
			this.enableNotifications = enableNotifications;
			return this;
		}

		public Builder maxBatchSize(int maxBatchSize) {
			this.maxBatchSize = maxBatchSize;
			return this;
		}

		public Builder maxInFlightMessages(int maxInFlightMessages) {
			this.maxInFlightMessages = maxInFlightMessages;
			return this;
		}

		public Builder shutdownDelay(Duration shutdownDelay) {
			this.shutdownDelay = shutdownDelay;
			return this;
		}

		public RouterConfig build() {
			return new RouterConfig(serverInfo, enableBatching, enableNotifications, maxBatchSize,
					maxInFlightMessages, shutdownDelay);
		}

	}

}
