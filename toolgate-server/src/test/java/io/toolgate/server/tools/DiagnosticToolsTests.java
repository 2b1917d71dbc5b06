/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import java.io.ByteArrayInputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.toolgate.server.McpToolServer;
import io.toolgate.server.transport.StdioTransportProvider;
import io.toolgate.session.ClientSession;
import io.toolgate.spec.McpSchema.ErrorCodes;
import io.toolgate.spec.TransportKind;
import io.toolgate.tools.ToolDefinition;
import io.toolgate.tools.ToolExecutionContext;
import io.toolgate.tools.ToolResult;

class DiagnosticToolsTests {

	private McpToolServer server;

	private ClientSession session;

	@BeforeEach
	void setUp() {
		server = McpToolServer
			.builder(new StdioTransportProvider(new ByteArrayInputStream(new byte[0]), OutputStream.nullOutputStream()))
			.build();
		session = server.getSessionManager().createSession("diagnostics-test", null, TransportKind.STDIO);
	}

	@AfterEach
	void tearDown() {
		server.stop().block(Duration.ofSeconds(5));
	}

	private ToolResult execute(String name, Map<String, Object> arguments) {
		return server.getToolRegistry()
			.executeTool(name, arguments, ToolExecutionContext.of(session, 1))
			.block(Duration.ofSeconds(5));
	}

	@Test
	void toolsAreRegisteredInDiagnosticsCategory() {
		assertThat(server.getToolRegistry().getToolsByCategory(DiagnosticTools.CATEGORY))
			.extracting(ToolDefinition::name)
			.containsExactly("echo_message", "server_status");
	}

	@Test
	void serverStatusReportsComponentStatistics() {
		ToolResult result = execute(DiagnosticTools.SERVER_STATUS, Map.of());

		assertThat(result.success()).isTrue();
		assertThat(result.data()).asInstanceOf(MAP)
			.containsKeys("status", "server", "transport", "uptime", "timestamp", "sessions", "tools", "messages",
					"errors")
			.containsEntry("transport", "stdio")
			.containsEntry("status", "stopped");
	}

	@Test
	void echoReturnsMessage() {
		ToolResult result = execute(DiagnosticTools.ECHO_MESSAGE, Map.of("message", "ping?"));

		assertThat(result.success()).isTrue();
		assertThat(result.data()).isEqualTo("ping?");
	}

	@Test
	void echoRequiresMessage() {
		ToolResult result = execute(DiagnosticTools.ECHO_MESSAGE, Map.of());

		assertThat(result.success()).isFalse();
		assertThat(result.error().code()).isEqualTo(ErrorCodes.INVALID_PARAMS);
		assertThat(result.error().message()).isEqualTo("Missing required parameter: message");
	}

	@Test
	void echoRejectsNonStringMessage() {
		ToolResult result = execute(DiagnosticTools.ECHO_MESSAGE, Map.of("message", 42));

		assertThat(result.error().code()).isEqualTo(ErrorCodes.INVALID_PARAMS);
	}

}
