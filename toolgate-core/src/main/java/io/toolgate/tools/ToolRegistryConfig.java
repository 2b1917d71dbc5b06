/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.time.Duration;

import io.toolgate.util.Assert;

/**
 * Settings of a {@link ToolRegistry}.
 *
 * @param validateParameters whether call arguments are checked against the declared
 * parameters
 * @param trackStatistics whether executions update the statistics
 * @param allowOverwrite whether registering an existing name replaces the tool
 * @param maxTools maximum number of registered tools
 * @param executionTimeout soft deadline of a single execution
 */
public record ToolRegistryConfig(boolean validateParameters, boolean trackStatistics, boolean allowOverwrite,
		int maxTools, Duration executionTimeout) {

	public ToolRegistryConfig {
		Assert.isTrue(maxTools > 0, "maxTools must be positive");
		Assert.notNull(executionTimeout, "executionTimeout must not be null");
		Assert.isTrue(!executionTimeout.isNegative() && !executionTimeout.isZero(),
				"executionTimeout must be positive");
	}

	public static ToolRegistryConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private boolean validateParameters = true;

		private boolean trackStatistics = true;

		private boolean allowOverwrite = false;

		private int maxTools = 1000;

		private Duration executionTimeout = Duration.ofSeconds(30);

		public Builder validateParameters(boolean validateParameters) {
			this.validateParameters = validateParameters;
			return this;
		}

		public Builder trackStatistics(boolean trackStatistics) {
			this.trackStatistics = trackStatistics;
			return this;
		}

		public Builder allowOverwrite(boolean allowOverwrite) {
			this.allowOverwrite = allowOverwrite;
			return this;
		}

		public Builder maxTools(int maxTools) {
			this.maxTools = maxTools;
			return this;
		}

		public Builder executionTimeout(Duration executionTimeout) {
			this.executionTimeout = executionTimeout;
			return this;
		}

		public ToolRegistryConfig build() {
			return new ToolRegistryConfig(validateParameters, trackStatistics, allowOverwrite, maxTools,
					executionTimeout);
		}

	}

}
