/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import java.util.Map;

/**
 * Message processing counters of a {@link ProtocolRouter}.
 *
 * @param totalMessages top-level payloads processed
 * @param successfulMessages payloads answered without a top-level error
 * @param failedMessages payloads answered with a top-level error
 * @param messagesByType counts keyed by method name, {@code batch}, {@code response} or
 * {@code invalid}
 * @param errorsByCode error responses keyed by code, batch members included
 * @param averageProcessingTime running mean in milliseconds
 * @param lastActivity epoch millis of the last processed payload
 */
public record RouterStats(long totalMessages, long successfulMessages, long failedMessages,
		Map<String, Long> messagesByType, Map<Integer, Long> errorsByCode, double averageProcessingTime,
		long lastActivity) {
}
