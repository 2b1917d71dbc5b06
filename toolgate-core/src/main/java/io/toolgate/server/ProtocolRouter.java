/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.error.ErrorContext;
import io.toolgate.error.ErrorKind;
import io.toolgate.error.McpErrorHandler;
import io.toolgate.error.RecoveryStrategies;
import io.toolgate.json.McpJsonMapper;
import io.toolgate.json.TypeRef;
import io.toolgate.session.ClientSession;
import io.toolgate.session.SessionManager;
import io.toolgate.session.SessionState;
import io.toolgate.spec.McpError;
import io.toolgate.spec.McpSchema;
import io.toolgate.spec.McpSchema.ErrorCodes;
import io.toolgate.spec.McpSchema.JSONRPCResponse;
import io.toolgate.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.toolgate.spec.ProtocolVersions;
import io.toolgate.tools.ToolDefinition;
import io.toolgate.tools.ToolExecutionContext;
import io.toolgate.tools.ToolRegistry;
import io.toolgate.tools.ToolResult;
import io.toolgate.util.Assert;
import io.toolgate.util.Utils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Turns raw JSON-RPC payloads into protocol responses.
 * <p>
 * A payload is parsed, validated and dispatched to the fixed method table
 * ({@code initialize}, {@code tools/list}, {@code tools/call}, {@code ping},
 * {@code shutdown}). Notifications and client responses never produce a reply. Batches
 * are processed member by member in array order; a failing member becomes an inline
 * error and does not affect its siblings. {@link #processMessage} never signals an
 * error.
 */
public class ProtocolRouter {

	private static final Logger logger = LoggerFactory.getLogger(ProtocolRouter.class);

	private static final TypeRef<Object> ANY_TYPE_REF = new TypeRef<>() {
	};

	static final String TYPE_BATCH = "batch";

	static final String TYPE_RESPONSE = "response";

	static final String TYPE_INVALID = "invalid";

	private final RouterConfig config;

	private final SessionManager sessionManager;

	private final ToolRegistry toolRegistry;

	private final McpErrorHandler errorHandler;

	private final McpJsonMapper jsonMapper;

	private final ShutdownHandler shutdownHandler;

	private final Map<String, RequestHandler> requestHandlers;

	private final List<RouterListener> listeners = new CopyOnWriteArrayList<>();

	private final AtomicInteger inFlight = new AtomicInteger();

	private final Object statsLock = new Object();

	private long totalMessages;

	private long successfulMessages;

	private long failedMessages;

	private final Map<String, Long> messagesByType = new TreeMap<>();

	private final Map<Integer, Long> errorsByCode = new TreeMap<>();

	private double averageProcessingTime;

	private long lastActivity;

	public ProtocolRouter(RouterConfig config, SessionManager sessionManager, ToolRegistry toolRegistry,
			McpErrorHandler errorHandler, McpJsonMapper jsonMapper, ShutdownHandler shutdownHandler) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(sessionManager, "sessionManager must not be null");
		Assert.notNull(toolRegistry, "toolRegistry must not be null");
		Assert.notNull(errorHandler, "errorHandler must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(shutdownHandler, "shutdownHandler must not be null");
		this.config = config;
		this.sessionManager = sessionManager;
		this.toolRegistry = toolRegistry;
		this.errorHandler = errorHandler;
		this.jsonMapper = jsonMapper;
		this.shutdownHandler = shutdownHandler;
		this.requestHandlers = Map.of(McpSchema.METHOD_INITIALIZE, this::handleInitialize,
				McpSchema.METHOD_TOOLS_LIST, this::handleListTools, McpSchema.METHOD_TOOLS_CALL, this::handleCallTool,
				McpSchema.METHOD_PING, this::handlePing, McpSchema.METHOD_SHUTDOWN, this::handleShutdown);
	}

	public void addListener(RouterListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(listener);
	}

	public void removeListener(RouterListener listener) {
		this.listeners.remove(listener);
	}

	/**
	 * Processes one inbound payload.
	 * @param raw the JSON text read by the transport
	 * @param context the session the payload arrived on
	 * @return the reply to send, or an empty {@link Mono} when nothing must be sent
	 */
	public Mono<RouterReply> processMessage(String raw, MessageContext context) {
		return Mono.defer(() -> {
			long startNanos = System.nanoTime();
			ClientSession session = context.session();

			Object parsed;
			try {
				parsed = jsonMapper.readValue(raw == null ? "" : raw, ANY_TYPE_REF);
			}
			catch (IOException | RuntimeException e) {
				logger.debug("Failed to parse message from session {}", session.getId(), e);
				JSONRPCResponse response = errorHandler.createErrorResponse(null, ErrorCodes.PARSE_ERROR,
						"Parse error", errorContext(null, session, null));
				return Mono.just(finish(TYPE_INVALID, new Outcome(response, true), context, startNanos));
			}

			Object requestId = parsed instanceof Map<?, ?> map ? readableId(map.get("id")) : null;
			if (this.inFlight.incrementAndGet() > config.maxInFlightMessages()) {
				this.inFlight.decrementAndGet();
				return Mono.justOrEmpty(reject(parsed, requestId, context, startNanos));
			}

			Mono<Outcome> outcome;
			String type;
			if (parsed instanceof List<?> batch) {
				type = TYPE_BATCH;
				outcome = processBatch(batch, context);
			}
			else if (parsed instanceof Map<?, ?> message) {
				type = messageType(message);
				outcome = processSingle(asMap(message), context);
			}
			else {
				type = TYPE_INVALID;
				outcome = Mono.just(new Outcome(errorHandler.createErrorResponse(null, ErrorCodes.INVALID_REQUEST,
						"Invalid Request: expected a JSON object or array", errorContext(null, session, null)),
						true));
			}

			return outcome.onErrorResume(e -> Mono.just(internalError(requestId, session, null, e)))
				.doFinally(signal -> this.inFlight.decrementAndGet())
				.flatMap(result -> Mono.justOrEmpty(finish(type, result, context, startNanos)));
		});
	}

	@Nullable
	private RouterReply reject(Object parsed, @Nullable Object requestId, MessageContext context, long startNanos) {
		String type = parsed instanceof List ? TYPE_BATCH
				: parsed instanceof Map<?, ?> message ? messageType(message) : TYPE_INVALID;
		if (parsed instanceof Map<?, ?> notification && notification.containsKey("method")
				&& !notification.containsKey("id")) {
			logger.warn("Dropping notification from session {}: too many messages in flight",
					context.session().getId());
			return finish(type, new Outcome(null, true), context, startNanos);
		}
		JSONRPCResponse response = errorHandler.createErrorResponse(requestId, ErrorCodes.RATE_LIMIT_EXCEEDED,
				"Too many messages in flight",
				errorContext(requestId, context.session(), null).withDetail("maxInFlightMessages",
						config.maxInFlightMessages()),
				RecoveryStrategies.forKind(ErrorKind.RATE_LIMIT_EXCEEDED));
		return finish(type, new Outcome(response, true), context, startNanos);
	}

	/**
	 * Checks the JSON-RPC envelope of a single message.
	 * @throws McpError INVALID_REQUEST describing the first violation
	 */
	public void validateMessage(Map<String, Object> message) {
		Object id = readableId(message.get("id"));
		if (!McpSchema.JSONRPC_VERSION.equals(message.get("jsonrpc"))) {
			throw invalidRequest(id, "Invalid Request: jsonrpc must be \"2.0\"");
		}
		boolean hasMethod = message.containsKey("method");
		boolean hasResult = message.containsKey("result");
		boolean hasError = message.containsKey("error");
		if (!hasMethod && !hasResult && !hasError) {
			throw invalidRequest(id, "Invalid Request: message must have a method, result or error");
		}
		if (hasMethod && !(message.get("method") instanceof String method && Utils.hasText(method))) {
			throw invalidRequest(id, "Invalid Request: method must be a non-empty string");
		}
		if (message.containsKey("id") && !(message.get("id") instanceof String || message.get("id") instanceof Number)) {
			throw invalidRequest(id, "Invalid Request: id must be a string or a number");
		}
		if (!hasMethod && !message.containsKey("id")) {
			throw invalidRequest(id, "Invalid Request: response must have an id");
		}
		if (hasResult && hasError) {
			throw invalidRequest(id, "Invalid Request: result and error are mutually exclusive");
		}
		if (hasError) {
			if (!(message.get("error") instanceof Map<?, ?> error && error.get("code") instanceof Number
					&& error.get("message") instanceof String)) {
				throw invalidRequest(id, "Invalid Request: error must have a numeric code and a string message");
			}
		}
	}

	private static McpError invalidRequest(@Nullable Object id, String message) {
		return new McpError(new JSONRPCError(ErrorCodes.INVALID_REQUEST, message,
				id == null ? null : Map.of("id", id)));
	}

	private Mono<Outcome> processBatch(List<?> batch, MessageContext context) {
		ClientSession session = context.session();
		if (!config.enableBatching()) {
			return Mono.just(new Outcome(errorHandler.createErrorResponse(null, ErrorCodes.INVALID_REQUEST,
					"Invalid Request: batch requests are not supported", errorContext(null, session, TYPE_BATCH)),
					true));
		}
		if (batch.isEmpty() || batch.size() > config.maxBatchSize()) {
			return Mono.just(new Outcome(errorHandler.createErrorResponse(null, ErrorCodes.INVALID_REQUEST,
					"Invalid Request: batch size must be between 1 and " + config.maxBatchSize(),
					errorContext(null, session, TYPE_BATCH).withDetail("batchSize", batch.size())), true));
		}

		logger.debug("Processing batch of {} message(s) for session {}", batch.size(), session.getId());
		return Flux.fromIterable(batch).concatMap(member -> {
			if (member instanceof Map<?, ?> message) {
				Object id = readableId(message.get("id"));
				return processSingle(asMap(message), context)
					.onErrorResume(e -> Mono.just(internalError(id, session, null, e)));
			}
			return Mono.just(new Outcome(errorHandler.createErrorResponse(null, ErrorCodes.INVALID_REQUEST,
					"Invalid Request: batch members must be objects", errorContext(null, session, TYPE_BATCH)),
					true));
		})
			.filter(outcome -> outcome.response() != null)
			.map(outcome -> (JSONRPCResponse) outcome.response())
			.collectList()
			.map(responses -> {
				responses.forEach(this::countError);
				return new Outcome(responses.isEmpty() ? null : responses, false);
			});
	}

	private Mono<Outcome> processSingle(Map<String, Object> message, MessageContext context) {
		ClientSession session = context.session();
		Object id = readableId(message.get("id"));
		boolean isNotification = message.containsKey("method") && !message.containsKey("id");

		try {
			validateMessage(message);
		}
		catch (McpError e) {
			JSONRPCError error = e.getJsonRpcError();
			JSONRPCResponse response = errorHandler.createErrorResponse(id, error.code(), error.message(),
					errorContext(id, session, null));
			// a message without id is never answered
			return Mono.just(new Outcome(isNotification ? null : response, true));
		}

		if (!message.containsKey("method")) {
			logger.debug("Dropping client response {} on session {}", id, session.getId());
			return Mono.just(new Outcome(null, false));
		}

		String method = (String) message.get("method");
		if (isNotification) {
			return Mono.just(handleNotification(method, message.get("params"), context));
		}

		if (!session.isLive()) {
			JSONRPCResponse response = JSONRPCResponse.failure(id, errorHandler
				.handleSessionError(session.getId(), "Session is no longer active (state: " + session.getState() + ")",
						errorContext(id, session, method))
				.getJsonRpcError());
			return Mono.just(new Outcome(response, true));
		}

		RequestHandler handler = this.requestHandlers.get(method);
		if (handler == null) {
			JSONRPCResponse response = errorHandler.createErrorResponse(id, ErrorCodes.METHOD_NOT_FOUND,
					"Method not found: " + method, errorContext(id, session, method));
			return Mono.just(new Outcome(response, true));
		}

		Request request;
		try {
			request = new Request(id, method, readParams(message.get("params"), id, session, method), context,
					errorContext(id, session, method));
		}
		catch (McpError e) {
			return Mono.just(new Outcome(JSONRPCResponse.failure(id, e.getJsonRpcError()), true));
		}

		return Mono.defer(() -> handler.handle(request))
			.map(result -> new Outcome(JSONRPCResponse.success(id, result), false))
			.onErrorResume(McpError.class,
					e -> Mono.just(new Outcome(JSONRPCResponse.failure(id, e.getJsonRpcError()), true)))
			.onErrorResume(e -> Mono.just(internalError(id, session, method, e)));
	}

	private Map<String, Object> readParams(@Nullable Object params, Object id, ClientSession session, String method) {
		if (params == null) {
			return Map.of();
		}
		if (params instanceof Map<?, ?> map) {
			return asMap(map);
		}
		throw errorHandler.handleValidationError("Invalid params: params must be an object",
				errorContext(id, session, method));
	}

	private Outcome handleNotification(String method, @Nullable Object params, MessageContext context) {
		ClientSession session = context.session();
		if (!config.enableNotifications()) {
			errorHandler.createErrorResponse(null, ErrorCodes.INVALID_REQUEST,
					"Invalid Request: notifications are disabled", errorContext(null, session, method));
			countError(ErrorCodes.INVALID_REQUEST);
			return new Outcome(null, true);
		}

		Map<String, Object> notificationParams = params instanceof Map<?, ?> map ? asMap(map) : Map.of();
		if (McpSchema.METHOD_NOTIFICATION_INITIALIZED.equals(method)) {
			sessionManager.updateMetadata(session, "clientInitialized", true);
			logger.info("Client initialized on session {}", session.getId());
			notifyListeners(listener -> listener.onClientInitialized(session));
		}
		else {
			logger.debug("Received notification {} on session {}", method, session.getId());
		}
		notifyListeners(listener -> listener.onNotification(session, method, notificationParams));
		return new Outcome(null, false);
	}

	// ---------------------------
	// Request handlers
	// ---------------------------

	private Mono<Object> handleInitialize(Request request) {
		Object requested = request.params().get("protocolVersion");
		if (requested != null && !(requested instanceof String)) {
			return Mono.error(errorHandler.handleValidationError("Invalid params: protocolVersion must be a string",
					request.errorContext()));
		}
		String version = requested == null ? ProtocolVersions.DEFAULT : (String) requested;
		if (!ProtocolVersions.isSupported(version)) {
			return Mono.error(errorHandler.handleValidationError("Unsupported protocol version: " + version,
					request.errorContext().withDetail("supportedVersions", ProtocolVersions.SUPPORTED)));
		}

		ClientSession session = request.context().session();
		try {
			sessionManager.updateMetadata(session, "protocolVersion", version);
			sessionManager.updateMetadata(session, "initialized", true);
			sessionManager.updateMetadata(session, "clientInfo", request.params().get("clientInfo"));
			if (session.getState() == SessionState.CONNECTING) {
				Object authentication = request.params().get("authentication");
				sessionManager.authenticateSession(session.getId(),
						authentication instanceof Map<?, ?> credentials ? asMap(credentials) : Map.of());
			}
		}
		catch (McpError e) {
			return Mono.error(e);
		}
		catch (RuntimeException e) {
			return Mono.error(errorHandler.createError(ErrorCodes.INITIALIZATION_FAILED,
					"Initialization failed: " + Utils.describe(e), request.errorContext()));
		}

		logger.info("Session {} initialized with protocol version {}", session.getId(), version);
		return Mono.just(new McpSchema.InitializeResult(version, McpSchema.ServerCapabilities.toolsAndLogging(),
				config.serverInfo()));
	}

	private Mono<Object> handleListTools(Request request) {
		ClientSession session = request.context().session();
		List<McpSchema.Tool> tools = toolRegistry.getAvailableTools()
			.stream()
			.filter(tool -> isVisible(session, tool.name()))
			.map(ToolDefinition::toListedTool)
			.toList();
		return Mono.just(new McpSchema.ListToolsResult(tools));
	}

	private Mono<Object> handleCallTool(Request request) {
		Object name = request.params().get("name");
		if (!(name instanceof String toolName) || !Utils.hasText(toolName)) {
			return Mono.error(errorHandler.handleValidationError("Invalid params: tool name is required",
					request.errorContext()));
		}
		Object arguments = request.params().get("arguments");
		if (arguments != null && !(arguments instanceof Map)) {
			return Mono.error(errorHandler.handleValidationError("Invalid params: arguments must be an object",
					request.errorContext()));
		}

		ClientSession session = request.context().session();
		if (!isVisible(session, toolName)) {
			return Mono.error(errorHandler.createError(ErrorCodes.TOOL_NOT_FOUND, "Tool not found: " + toolName,
					request.errorContext()));
		}

		sessionManager.recordToolCall(session);
		ToolExecutionContext executionContext = new ToolExecutionContext(session, session.getUser(), request.id(),
				request.context().receivedAt());
		Map<String, Object> callArguments = arguments == null ? Map.of() : asMap((Map<?, ?>) arguments);
		return toolRegistry.executeTool(toolName, callArguments, executionContext).map(this::toCallToolResult);
	}

	private Object toCallToolResult(ToolResult result) {
		if (result.success()) {
			return McpSchema.CallToolResult.text(toText(result.data()), false);
		}
		if (result.error().code() == ErrorCodes.TOOL_EXECUTION_FAILED) {
			return McpSchema.CallToolResult.text(result.error().message(), true);
		}
		throw new McpError(new JSONRPCError(result.error().code(), result.error().message(), result.error().details()));
	}

	private String toText(@Nullable Object data) {
		if (data == null) {
			return "";
		}
		if (data instanceof String text) {
			return text;
		}
		try {
			return jsonMapper.writeValueAsString(data);
		}
		catch (IOException e) {
			logger.warn("Failed to serialize tool result, falling back to toString: {}", Utils.describe(e));
			return String.valueOf(data);
		}
	}

	private Mono<Object> handlePing(Request request) {
		long now = System.currentTimeMillis();
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("pong", true);
		result.put("timestamp", Instant.ofEpochMilli(now).toString());
		result.put("serverTime", now);
		return Mono.just(result);
	}

	private Mono<Object> handleShutdown(Request request) {
		ClientSession session = request.context().session();
		logger.info("Shutdown requested by session {}", session.getId());
		notifyListeners(listener -> listener.onShutdownRequested(session));
		Mono.delay(config.shutdownDelay())
			.then(Mono.defer(shutdownHandler::shutdown))
			.subscribe(null, e -> logger.error("Shutdown failed", e));
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("shutdown", true);
		result.put("message", "Server shutdown initiated");
		return Mono.just(result);
	}

	private static boolean isVisible(ClientSession session, String toolName) {
		return session.getVisibleTools().isEmpty() || session.getVisibleTools().contains(toolName);
	}

	// ---------------------------
	// Statistics
	// ---------------------------

	public RouterStats getStats() {
		synchronized (statsLock) {
			return new RouterStats(totalMessages, successfulMessages, failedMessages, Map.copyOf(messagesByType),
					Map.copyOf(errorsByCode), averageProcessingTime, lastActivity);
		}
	}

	public void resetStats() {
		synchronized (statsLock) {
			totalMessages = 0;
			successfulMessages = 0;
			failedMessages = 0;
			messagesByType.clear();
			errorsByCode.clear();
			averageProcessingTime = 0;
			lastActivity = 0;
		}
	}

	@Nullable
	@SuppressWarnings("unchecked")
	private RouterReply finish(String type, Outcome outcome, MessageContext context, long startNanos) {
		long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
		Object reply = outcome.response();
		boolean failed = outcome.failed();
		if (reply instanceof JSONRPCResponse response) {
			countError(response);
			failed = failed || response.error() != null;
		}
		synchronized (statsLock) {
			totalMessages++;
			if (failed) {
				failedMessages++;
			}
			else {
				successfulMessages++;
			}
			messagesByType.merge(type, 1L, Long::sum);
			averageProcessingTime = (averageProcessingTime * (totalMessages - 1) + elapsed) / totalMessages;
			lastActivity = System.currentTimeMillis();
		}
		if (context.session().isLive()) {
			sessionManager.touch(context.session(), elapsed);
		}

		if (reply instanceof JSONRPCResponse response) {
			return new RouterReply.Single(response);
		}
		if (reply instanceof List<?> responses) {
			return new RouterReply.Batch((List<JSONRPCResponse>) responses);
		}
		return null;
	}

	private void countError(JSONRPCResponse response) {
		if (response.error() != null && response.error().code() != null) {
			countError(response.error().code());
		}
	}

	private void countError(int code) {
		synchronized (statsLock) {
			errorsByCode.merge(code, 1L, Long::sum);
		}
	}

	// ---------------------------
	// Helpers
	// ---------------------------

	private Outcome internalError(@Nullable Object id, ClientSession session, @Nullable String method, Throwable e) {
		logger.error("Unexpected failure while routing message {} on session {}", id, session.getId(), e);
		return new Outcome(errorHandler.createErrorResponse(id, ErrorCodes.INTERNAL_ERROR,
				"Internal error: " + Utils.describe(e), errorContext(id, session, method)), true);
	}

	private static ErrorContext errorContext(@Nullable Object id, ClientSession session, @Nullable String operation) {
		return new ErrorContext(id, session.getId(), operation, Map.of());
	}

	private static String messageType(Map<?, ?> message) {
		if (message.get("method") instanceof String method) {
			return method;
		}
		if (message.containsKey("result") || message.containsKey("error")) {
			return TYPE_RESPONSE;
		}
		return TYPE_INVALID;
	}

	@Nullable
	private static Object readableId(@Nullable Object id) {
		return id instanceof String || id instanceof Number ? id : null;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Map<?, ?> map) {
		return (Map<String, Object>) map;
	}

	private void notifyListeners(Consumer<RouterListener> event) {
		for (RouterListener listener : this.listeners) {
			try {
				event.accept(listener);
			}
			catch (Exception e) {
				logger.error("Router listener failed", e);
			}
		}
	}

	@FunctionalInterface
	private interface RequestHandler {

		Mono<Object> handle(Request request);

	}

	private record Request(Object id, String method, Map<String, Object> params, MessageContext context,
			ErrorContext errorContext) {
	}

	/**
	 * Result of routing one payload. {@code response} is a {@link JSONRPCResponse}, a
	 * list of them for batches, or {@code null} when nothing is sent back.
	 */
	private record Outcome(@Nullable Object response, boolean failed) {
	}

}
