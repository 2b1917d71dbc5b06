/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

/**
 * One recorded error in the handler's ring buffer.
 */
public record ErrorLogEntry(long timestamp, int code, String message, ErrorSeverity severity, Object requestId,
		String sessionId, String operation) {
}
