/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.toolgate.server.tools.DiagnosticTools;
import io.toolgate.server.transport.StdioTransportProvider;
import io.toolgate.server.transport.TcpTransportProvider;
import io.toolgate.session.PermissionLevel;
import io.toolgate.session.UserContext;
import io.toolgate.tools.ToolAuthRequirement;
import io.toolgate.tools.ToolDefinition;
import io.toolgate.tools.ToolSpecification;

class McpToolServerTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(10);

	private McpToolServer server;

	@AfterEach
	void tearDown() {
		if (server != null) {
			server.stop().block(TIMEOUT);
		}
	}

	@Test
	void servesStdioSessionUntilInputEnds() throws Exception {
		String input = String.join("\n", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}",
				"{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
				"{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}",
				"{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"echo_message\",\"arguments\":{\"message\":\"hi\"}}}",
				"[{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"ping\"},{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"ping\"}]")
				+ "\n";
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		server = McpToolServer
			.builder(new StdioTransportProvider(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out))
			.build();

		server.start();

		assertThat(server.awaitTermination(TIMEOUT)).isTrue();
		assertThat(server.isRunning()).isFalse();
		String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
		assertThat(lines).hasSize(4);
		assertThatJson(lines[0]).node("result.serverInfo.name").isEqualTo("toolgate");
		assertThatJson(lines[1]).node("result.tools").isArray().hasSize(2);
		assertThatJson(lines[1]).node("result.tools[0].name").isEqualTo("echo_message");
		assertThatJson(lines[1]).node("result.tools[1].name").isEqualTo("server_status");
		assertThatJson(lines[2]).node("result.content[0].text").isEqualTo("hi");
		assertThatJson(lines[3]).isArray().hasSize(2);
		assertThat(server.getSessionManager().getSessionCount()).isZero();
	}

	@Test
	void shutdownRequestStopsServer() throws Exception {
		PipedOutputStream client = new PipedOutputStream();
		PipedInputStream in = new PipedInputStream(client);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		server = McpToolServer.builder(new StdioTransportProvider(in, out))
			.config(ServerConfig.builder().shutdownDelay(Duration.ofMillis(50)).build())
			.build();
		server.start();

		client.write("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"shutdown\"}\n".getBytes(StandardCharsets.UTF_8));
		client.flush();

		assertThat(server.awaitTermination(TIMEOUT)).isTrue();
		assertThatJson(out.toString(StandardCharsets.UTF_8).trim()).node("result.shutdown").isEqualTo(true);
		client.close();
	}

	@Test
	void registersCustomTools() {
		server = McpToolServer
			.builder(new StdioTransportProvider(new ByteArrayInputStream(new byte[0]), OutputStream.nullOutputStream()))
			.config(ServerConfig.builder().builtInTools(false).build())
			.tool(ToolSpecification.builder()
				.tool(ToolDefinition.builder().name("list_items").description("Lists items").build())
				.syncCallHandler((arguments, context) -> "[]")
				.build())
			.build();

		assertThat(server.getToolRegistry().hasTool("list_items")).isTrue();
		assertThat(server.getToolRegistry().hasTool(DiagnosticTools.SERVER_STATUS)).isFalse();
		assertThat(server.isRunning()).isFalse();
	}

	@Test
	void authenticatedClientRunsPermittedTools() throws Exception {
		String input = String.join("\n",
				"{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"authentication\":{\"token\":\"ops-token\"}}}",
				"{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"purge_cache\"}}",
				"{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"drop_tables\"}}")
				+ "\n";
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		server = McpToolServer
			.builder(new StdioTransportProvider(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out))
			.config(ServerConfig.builder().builtInTools(false).build())
			.authenticator((session, authData) -> {
				if (!"ops-token".equals(authData.get("token"))) {
					throw new IllegalArgumentException("Unknown token");
				}
				return new UserContext("ops", Set.of("cache:purge"), Set.of(), PermissionLevel.WRITE);
			})
			.tool(ToolSpecification.builder()
				.tool(ToolDefinition.builder()
					.name("purge_cache")
					.description("Purges the cache")
					.authRequirement(ToolAuthRequirement.permissions("cache:purge"))
					.build())
				.syncCallHandler((arguments, context) -> "purged by " + context.user().userId())
				.build())
			.tool(ToolSpecification.builder()
				.tool(ToolDefinition.builder()
					.name("drop_tables")
					.description("Drops every table")
					.authRequirement(ToolAuthRequirement.level(PermissionLevel.ADMIN))
					.build())
				.syncCallHandler((arguments, context) -> "dropped")
				.build())
			.build();

		server.start();

		assertThat(server.awaitTermination(TIMEOUT)).isTrue();
		String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
		assertThat(lines).hasSize(3);
		assertThatJson(lines[0]).node("result.serverInfo.name").isEqualTo("toolgate");
		assertThatJson(lines[1]).node("result.isError").isEqualTo(false);
		assertThatJson(lines[1]).node("result.content[0].text").isEqualTo("purged by ops");
		assertThatJson(lines[2]).node("error.code").isEqualTo(-32007);
	}

	@Test
	void servesTcpConnections() throws Exception {
		TcpTransportProvider transport = new TcpTransportProvider("127.0.0.1", 0);
		server = McpToolServer.builder(transport).build();
		server.start();

		try (Socket socket = new Socket("127.0.0.1", transport.getLocalPort());
				PrintWriter writer = new PrintWriter(socket.getOutputStream(), true, StandardCharsets.UTF_8);
				BufferedReader reader = new BufferedReader(
						new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))) {
			writer.println("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");
			assertThatJson(reader.readLine()).node("result.pong").isEqualTo(true);

			writer.println(
					"{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"server_status\"}}");
			String status = reader.readLine();
			assertThatJson(status).node("result.isError").isEqualTo(false);
			assertThatJson(status).node("result.content[0].text")
				.isString()
				.contains("\"transport\":\"tcp\"")
				.contains("\"activeConnections\":1");
		}

		server.stop().block(TIMEOUT);
		assertThat(server.awaitTermination(TIMEOUT)).isTrue();
	}

	@Test
	void startFailsWhenPortIsTaken() throws IOException {
		try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
			server = McpToolServer.builder(new TcpTransportProvider("127.0.0.1", occupied.getLocalPort())).build();

			assertThatThrownBy(server::start).isInstanceOf(IOException.class);
		}
	}

	@Test
	void startTwiceFails() throws Exception {
		server = McpToolServer.builder(new TcpTransportProvider("127.0.0.1", 0)).build();
		server.start();

		assertThatThrownBy(server::start).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void stopIsIdempotent() throws Exception {
		server = McpToolServer.builder(new TcpTransportProvider("127.0.0.1", 0)).build();
		server.start();

		server.stop().block(TIMEOUT);
		server.stop().block(TIMEOUT);

		assertThat(server.awaitTermination(Duration.ofMillis(100))).isTrue();
		assertThat(server.isRunning()).isFalse();
	}

}
