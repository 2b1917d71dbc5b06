/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import java.time.Duration;

import io.toolgate.session.SessionManagerConfig;
import io.toolgate.tools.ToolRegistryConfig;
import io.toolgate.util.Assert;

/**
 * Settings of a {@link McpToolServer}, grouping the settings of its components.
 *
 * @param sessions session manager settings
 * @param tools tool registry settings
 * @param router protocol router settings
 * @param builtInTools whether the diagnostic tools are registered on startup
 */
public record ServerConfig(SessionManagerConfig sessions, ToolRegistryConfig tools, RouterConfig router,
		boolean builtInTools) {

	public ServerConfig {
		Assert.notNull(sessions, "sessions must not be null");
		Assert.notNull(tools, "tools must not be null");
		Assert.notNull(router, "router must not be null");
	}

	public static ServerConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private final SessionManagerConfig.Builder sessions = SessionManagerConfig.builder();

		private final ToolRegistryConfig.Builder tools = ToolRegistryConfig.builder();

		private final RouterConfig.Builder router = RouterConfig.builder();

		private boolean builtInTools = true;

		public Builder maxClients(int maxClients) {
			this.sessions.maxConnections(maxClients);
			return this;
		}

		public Builder sessionTimeout(Duration sessionTimeout) {
			this.sessions.defaultTimeout(sessionTimeout);
			return this;
		}

		public Builder shutdownTimeout(Duration shutdownTimeout) {
			this.sessions.shutdownTimeout(shutdownTimeout);
			return this;
		}

		public Builder executionTimeout(Duration executionTimeout) {
			this.tools.executionTimeout(executionTimeout);
			return this;
		}

		public Builder maxTools(int maxTools) {
			this.tools.maxTools(maxTools);
			return this;
		}

		public Builder serverInfo(String name, String version) {
			this.router.serverInfo(name, version);
			return this;
		}

		public Builder shutdownDelay(Duration shutdownDelay) {
			this.router.shutdownDelay(shutdownDelay);
			return this;
		}

		public Builder builtInTools(boolean builtInTools) {
			this.builtInTools = builtInTools;
			return this;
		}

		public ServerConfig build() {
			return new ServerConfig(this.sessions.build(), this.tools.build(), this.router.build(), this.builtInTools);
		}

	}

}
