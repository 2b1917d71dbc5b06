/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.spec;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.toolgate.json.TypeRef;
import io.toolgate.util.Assert;

/**
 * Wire types of the JSON-RPC 2.0 based Model Context Protocol subset served by Toolgate.
 * Based on the <a href="http://www.jsonrpc.org/specification">JSON-RPC 2.0
 * specification</a> and the <a href=
 * "https://github.com/modelcontextprotocol/specification/blob/main/schema/2024-11-05/schema.ts">Model
 * Context Protocol Schema</a>.
 */
public final class McpSchema {

	private McpSchema() {
	}

	public static final String JSONRPC_VERSION = "2.0";

	// ---------------------------
	// Method Names
	// ---------------------------

	// Lifecycle Methods
	public static final String METHOD_INITIALIZE = "initialize";

	public static final String METHOD_NOTIFICATION_INITIALIZED = "notifications/initialized";

	public static final String METHOD_PING = "ping";

	public static final String METHOD_SHUTDOWN = "shutdown";

	// Tool Methods
	public static final String METHOD_TOOLS_LIST = "tools/list";

	public static final String METHOD_TOOLS_CALL = "tools/call";

	public static final TypeRef<Map<String, Object>> MAP_TYPE_REF = new TypeRef<>() {
	};

	// ---------------------------
	// JSON-RPC Error Codes
	// ---------------------------
	/**
	 * Standard error codes used in MCP JSON-RPC responses, followed by the server-defined
	 * codes in the {@code -32000..-32010} range.
	 */
	public static final class ErrorCodes {

		ErrorCodes() {
			// Prevent instantiation
		}

		/**
		 * Invalid JSON was received by the server.
		 */
		public static final int PARSE_ERROR = -32700;

		/**
		 * The JSON sent is not a valid Request object.
		 */
		public static final int INVALID_REQUEST = -32600;

		/**
		 * The method does not exist / is not available.
		 */
		public static final int METHOD_NOT_FOUND = -32601;

		/**
		 * Invalid method parameter(s).
		 */
		public static final int INVALID_PARAMS = -32602;

		/**
		 * Internal JSON-RPC error.
		 */
		public static final int INTERNAL_ERROR = -32603;

		/**
		 * The initialize handshake could not be completed.
		 */
		public static final int INITIALIZATION_FAILED = -32000;

		/**
		 * No enabled tool is registered under the requested name.
		 */
		public static final int TOOL_NOT_FOUND = -32001;

		/**
		 * The tool threw, failed or exceeded its execution deadline.
		 */
		public static final int TOOL_EXECUTION_FAILED = -32002;

		public static final int TRANSPORT_ERROR = -32003;

		public static final int SESSION_EXPIRED = -32004;

		public static final int RATE_LIMIT_EXCEEDED = -32005;

		public static final int AUTHENTICATION_FAILED = -32006;

		public static final int AUTHORIZATION_FAILED = -32007;

		public static final int RESOURCE_NOT_FOUND = -32008;

		public static final int CONCURRENT_OPERATION = -32009;

		public static final int MEMORY_LIMIT_EXCEEDED = -32010;

	}

	// ---------------------------
	// JSON-RPC Message Types
	// ---------------------------
	public sealed interface JSONRPCMessage permits JSONRPCRequest, JSONRPCNotification, JSONRPCResponse {

		String jsonrpc();

	}

	/**
	 * A request that expects a response.
	 *
	 * @param jsonrpc The JSON-RPC version (must be "2.0")
	 * @param method The name of the method to be invoked
	 * @param id A unique identifier for the request
	 * @param params Parameters for the method call
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCRequest( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("method") String method,
		@JsonProperty("id") Object id,
		@JsonProperty("params") Object params) implements JSONRPCMessage { // @formatter:on

		public JSONRPCRequest {
			Assert.notNull(id, "Requests must include an id");
		}
	}

	/**
	 * A notification which does not expect a response.
	 *
	 * @param jsonrpc The JSON-RPC version (must be "2.0")
	 * @param method The name of the method being notified
	 * @param params Parameters for the notification
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCNotification( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("method") String method,
		@JsonProperty("params") Object params) implements JSONRPCMessage { // @formatter:on
	}

	/**
	 * A response to a request (successful, or error). The {@code id} is always written,
	 * as {@code null} when the request id could not be recovered.
	 *
	 * @param jsonrpc The JSON-RPC version (must be "2.0")
	 * @param id The request identifier that this response corresponds to
	 * @param result The result of the successful request; null if error
	 * @param error Error information if the request failed; null if successful
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JSONRPCResponse( // @formatter:off
		@JsonProperty("jsonrpc") String jsonrpc,
		@JsonProperty("id") @JsonInclude(JsonInclude.Include.ALWAYS) Object id,
		@JsonProperty("result") Object result,
		@JsonProperty("error") JSONRPCError error) implements JSONRPCMessage { // @formatter:on

		public static JSONRPCResponse success(Object id, Object result) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, result, null);
		}

		public static JSONRPCResponse failure(Object id, JSONRPCError error) {
			return new JSONRPCResponse(JSONRPC_VERSION, id, null, error);
		}

		/**
		 * A response to a request that indicates an error occurred.
		 *
		 * @param code The error type that occurred
		 * @param message A short description of the error. The message SHOULD be limited
		 * to a concise single sentence
		 * @param data Additional information about the error
		 */
		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		@JsonIgnoreProperties(ignoreUnknown = true)
		public record JSONRPCError( // @formatter:off
			@JsonProperty("code") Integer code,
			@JsonProperty("message") String message,
			@JsonProperty("data") Object data) { // @formatter:on
		}
	}

	// ---------------------------
	// Initialization
	// ---------------------------
	/**
	 * After receiving an initialize request from the client, the server sends this
	 * response.
	 *
	 * @param protocolVersion The version of the Model Context Protocol the server agreed
	 * to use
	 * @param capabilities The capabilities that the server supports
	 * @param serverInfo Information about the server implementation
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record InitializeResult( // @formatter:off
		@JsonProperty("protocolVersion") String protocolVersion,
		@JsonProperty("capabilities") ServerCapabilities capabilities,
		@JsonProperty("serverInfo") Implementation serverInfo) { // @formatter:on
	}

	/**
	 * Capabilities a server may support.
	 *
	 * @param tools Present if the server offers any tools to call
	 * @param logging Present if the server supports sending log messages to the client
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ServerCapabilities( // @formatter:off
		@JsonProperty("tools") ToolCapabilities tools,
		@JsonProperty("logging") Map<String, Object> logging) { // @formatter:on

		@JsonInclude(JsonInclude.Include.NON_ABSENT)
		public record ToolCapabilities(@JsonProperty("listChanged") Boolean listChanged) {
		}

		public static ServerCapabilities toolsAndLogging() {
			return new ServerCapabilities(new ToolCapabilities(true), Map.of());
		}
	}

	/**
	 * Name and version of an MCP implementation.
	 *
	 * @param name Intended for programmatic or logical use
	 * @param version The version of the implementation
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Implementation( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("version") String version) { // @formatter:on
	}

	// ---------------------------
	// Tools
	// ---------------------------
	/**
	 * The server's response to a tools/list request from the client.
	 *
	 * @param tools A list of tools that the server provides
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ListToolsResult(@JsonProperty("tools") List<Tool> tools) {
	}

	/**
	 * A JSON Schema object describing the expected arguments of a tool.
	 *
	 * @param type The type of the schema (always "object" for tool inputs)
	 * @param properties The properties of the schema object
	 * @param required List of property names that are required
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record JsonSchema( // @formatter:off
		@JsonProperty("type") String type,
		@JsonProperty("properties") Map<String, Object> properties,
		@JsonProperty("required") List<String> required) { // @formatter:on
	}

	/**
	 * Represents a tool that the server provides, as listed to clients.
	 *
	 * @param name A unique identifier for the tool
	 * @param description A human-readable description of what the tool does
	 * @param inputSchema A JSON Schema object that describes the expected structure of
	 * the arguments
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Tool( // @formatter:off
		@JsonProperty("name") String name,
		@JsonProperty("description") String description,
		@JsonProperty("inputSchema") JsonSchema inputSchema) { // @formatter:on
	}

	/**
	 * The server's response to a tools/call request from the client.
	 *
	 * @param content A list of content items representing the tool's output
	 * @param isError If true, indicates that the tool execution failed and the content
	 * contains error information
	 */
	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CallToolResult( // @formatter:off
		@JsonProperty("content") List<TextContent> content,
		@JsonProperty("isError") Boolean isError) { // @formatter:on

		public static CallToolResult text(String text, boolean isError) {
			return new CallToolResult(List.of(new TextContent(text)), isError);
		}
	}

	@JsonInclude(JsonInclude.Include.NON_ABSENT)
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TextContent( // @formatter:off
		@JsonProperty("type") String type,
		@JsonProperty("text") String text) { // @formatter:on

		public TextContent(String text) {
			this("text", text);
		}
	}

}
