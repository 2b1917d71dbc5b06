/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.tools;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import io.toolgate.server.McpToolServer;
import io.toolgate.tools.ParameterType;
import io.toolgate.tools.ToolDefinition;
import io.toolgate.tools.ToolParameter;
import io.toolgate.tools.ToolSpecification;
import io.toolgate.util.Assert;

/**
 * Tools every server registers so clients can check that the server is alive and
 * inspect its state.
 */
public final class DiagnosticTools {

	public static final String CATEGORY = "diagnostics";

	public static final String SERVER_STATUS = "server_status";

	public static final String ECHO_MESSAGE = "echo_message";

	private DiagnosticTools() {
	}

	/**
	 * Reports session, registry, router and error statistics of {@code server}.
	 */
	public static ToolSpecification serverStatus(McpToolServer server) {
		Assert.notNull(server, "server must not be null");
		return ToolSpecification.builder()
			.tool(ToolDefinition.builder()
				.name(SERVER_STATUS)
				.description("Reports the server's session, tool, message and error statistics")
				.category(CATEGORY)
				.build())
			.syncCallHandler((arguments, context) -> {
				Map<String, Object> status = new LinkedHashMap<>();
				status.put("status", server.isRunning() ? "running" : "stopped");
				status.put("server", server.getConfig().router().serverInfo());
				status.put("transport", server.getTransportProvider().kind().id());
				status.put("uptime", server.getUptime());
				status.put("timestamp", Instant.now().toString());
				status.put("sessions", server.getSessionManager().getStats());
				status.put("tools", server.getToolRegistry().getRegistryStats());
				status.put("messages", server.getRouter().getStats());
				status.put("errors", server.getErrorHandler().getErrorStatistics());
				return status;
			})
			.build();
	}

	/**
	 * Returns the {@code message} argument unchanged.
	 */
	public static ToolSpecification echoMessage() {
		return ToolSpecification.builder()
			.tool(ToolDefinition.builder()
				.name(ECHO_MESSAGE)
				.description("Echoes the given message back to the caller")
				.category(CATEGORY)
				.parameter(ToolParameter.required("message", ParameterType.STRING, "The message to echo"))
				.build())
			.syncCallHandler((arguments, context) -> arguments.get("message"))
			.build();
	}

}
