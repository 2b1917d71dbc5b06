/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolgate.spec.McpError;
import io.toolgate.spec.McpSchema.ErrorCodes;
import io.toolgate.spec.McpSchema.JSONRPCResponse;
import io.toolgate.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.toolgate.util.Assert;
import io.toolgate.util.Utils;

/**
 * Turns failures into structured JSON-RPC errors. Every error created here is logged at
 * the level derived from its {@link ErrorSeverity}, appended to a bounded ring buffer and
 * counted per code.
 */
public class McpErrorHandler {

	private static final Logger logger = LoggerFactory.getLogger(McpErrorHandler.class);

	public static final int DEFAULT_LOG_CAPACITY = 1000;

	public static final int RECENT_ERRORS = 10;

	public static final long ERROR_RATE_WINDOW_MILLIS = 60_000;

	private final int logCapacity;

	private final LongSupplier currentTimeMillisSupplier;

	private final Deque<ErrorLogEntry> errorLog = new ArrayDeque<>();

	private final Map<Integer, Long> errorCounts = new TreeMap<>();

	private long totalErrors;

	private final ReentrantLock lock = new ReentrantLock();

	public McpErrorHandler() {
		this(DEFAULT_LOG_CAPACITY, System::currentTimeMillis);
	}

	public McpErrorHandler(int logCapacity, LongSupplier currentTimeMillisSupplier) {
		Assert.isTrue(logCapacity > 0, "logCapacity must be positive");
		Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
		this.logCapacity = logCapacity;
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
	}

	/**
	 * Builds, records and logs an error response.
	 * @param id the request id to echo, may be {@code null}
	 * @param code the protocol error code
	 * @param message a single line description
	 * @param context where the error happened
	 * @return the error response addressed to {@code id}
	 */
	public JSONRPCResponse createErrorResponse(Object id, int code, String message, ErrorContext context) {
		return createErrorResponse(id, code, message, context, List.of());
	}

	public JSONRPCResponse createErrorResponse(Object id, int code, String message, ErrorContext context,
			List<RecoveryStrategy> recovery) {
		ErrorContext effective = context == null ? ErrorContext.EMPTY : context;
		if (effective.requestId() == null && id != null) {
			effective = new ErrorContext(id, effective.sessionId(), effective.operation(), effective.details());
		}
		return JSONRPCResponse.failure(id, record(code, message, effective, recovery));
	}

	/**
	 * Builds, records and logs an error and returns it as a throwable {@link McpError}.
	 */
	public McpError createError(int code, String message, ErrorContext context) {
		return createError(code, message, context, List.of());
	}

	public McpError createError(int code, String message, ErrorContext context, List<RecoveryStrategy> recovery) {
		return new McpError(record(code, message, context == null ? ErrorContext.EMPTY : context, recovery));
	}

	/**
	 * Builds an error for a domain failure kind, attaching the kind's recovery
	 * suggestions.
	 */
	public McpError createError(ErrorKind kind, String message, ErrorContext context) {
		return createError(kind.code(), message, context, RecoveryStrategies.forKind(kind));
	}

	public McpError handleToolError(String toolName, Throwable error, ErrorContext context) {
		ErrorContext effective = (context == null ? ErrorContext.EMPTY : context).withDetail("toolName", toolName);
		return createError(ErrorCodes.TOOL_EXECUTION_FAILED,
				"Tool execution failed: " + Utils.describe(error), effective);
	}

	public McpError handleValidationError(String message, ErrorContext context) {
		return createError(ErrorCodes.INVALID_PARAMS, message, context);
	}

	public McpError handleTransportError(Throwable error, ErrorContext context) {
		return createError(ErrorCodes.TRANSPORT_ERROR, "Transport error: " + Utils.describe(error), context,
				RecoveryStrategies.forKind(ErrorKind.NETWORK_ERROR));
	}

	public McpError handleRateLimitError(String message, ErrorContext context) {
		return createError(ErrorKind.RATE_LIMIT_EXCEEDED, message, context);
	}

	/**
	 * Builds an authentication or authorization failure for the given kind.
	 */
	public McpError handleAuthenticationError(ErrorKind kind, String message, ErrorContext context) {
		return createError(kind, message, context);
	}

	/**
	 * Builds a MEMORY_LIMIT_EXCEEDED error reporting usage against the limit. Details
	 * already present in {@code context} take precedence.
	 * @param currentUsage bytes in use
	 * @param limit allowed bytes, positive
	 * @param context where the check ran, may be {@code null}
	 */
	public McpError handleMemoryError(long currentUsage, long limit, ErrorContext context) {
		Assert.isTrue(limit > 0, "limit must be positive");
		ErrorContext base = context == null ? ErrorContext.EMPTY : context;
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("currentUsage", currentUsage);
		details.put("limit", limit);
		details.put("usagePercentage", Math.round(currentUsage * 100.0 / limit));
		details.putAll(base.details());
		return createError(ErrorCodes.MEMORY_LIMIT_EXCEEDED,
				"Memory limit exceeded: " + currentUsage + " bytes (limit: " + limit + " bytes)",
				new ErrorContext(base.requestId(), base.sessionId(), "memory_check", details));
	}

	public McpError handleSessionError(String sessionId, String message, ErrorContext context) {
		ErrorContext effective = context == null ? ErrorContext.EMPTY : context;
		if (effective.sessionId() == null) {
			effective = new ErrorContext(effective.requestId(), sessionId, effective.operation(),
					effective.details());
		}
		return createError(ErrorKind.SESSION_EXPIRED, message, effective);
	}

	/**
	 * Returns a snapshot of the error counters.
	 */
	public ErrorStatistics getErrorStatistics() {
		lock.lock();
		try {
			long windowStart = currentTimeMillisSupplier.getAsLong() - ERROR_RATE_WINDOW_MILLIS;
			long rate = errorLog.stream().filter(entry -> entry.timestamp() >= windowStart).count();
			List<ErrorLogEntry> all = new ArrayList<>(errorLog);
			List<ErrorLogEntry> recent = all.subList(Math.max(0, all.size() - RECENT_ERRORS), all.size());
			return new ErrorStatistics(totalErrors, Map.copyOf(errorCounts), List.copyOf(recent), rate);
		}
		finally {
			lock.unlock();
		}
	}

	public void clearErrorLog() {
		lock.lock();
		try {
			errorLog.clear();
			errorCounts.clear();
			totalErrors = 0;
		}
		finally {
			lock.unlock();
		}
	}

	private JSONRPCError record(int code, String message, ErrorContext context, List<RecoveryStrategy> recovery) {
		long now = currentTimeMillisSupplier.getAsLong();
		ErrorSeverity severity = ErrorSeverity.of(code);

		Map<String, Object> data = new LinkedHashMap<>();
		data.put("timestamp", Instant.ofEpochMilli(now).toString());
		putIfPresent(data, "requestId", context.requestId());
		putIfPresent(data, "sessionId", context.sessionId());
		putIfPresent(data, "operation", context.operation());
		if (!context.details().isEmpty()) {
			data.put("context", context.details());
		}
		if (!Utils.isEmpty(recovery)) {
			data.put("recovery", recovery);
		}

		lock.lock();
		try {
			errorLog.addLast(new ErrorLogEntry(now, code, message, severity, context.requestId(), context.sessionId(),
					context.operation()));
			while (errorLog.size() > logCapacity) {
				errorLog.removeFirst();
			}
			errorCounts.merge(code, 1L, Long::sum);
			totalErrors++;
		}
		finally {
			lock.unlock();
		}

		log(severity, code, message, context);
		return new JSONRPCError(code, message, data);
	}

	private static void putIfPresent(Map<String, Object> data, String key, Object value) {
		if (value != null) {
			data.put(key, value);
		}
	}

	private static void log(ErrorSeverity severity, int code, String message, ErrorContext context) {
		String format = "MCP error [{}] {} (session: {}, request: {}, operation: {})";
		Object[] args = { code, message, context.sessionId(), context.requestId(), context.operation() };
		switch (severity) {
			case LOW -> logger.debug(format, args);
			case MEDIUM -> logger.warn(format, args);
			default -> logger.error(format, args);
		}
	}

}
