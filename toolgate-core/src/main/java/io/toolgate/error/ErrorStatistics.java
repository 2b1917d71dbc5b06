/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of error counters.
 *
 * @param totalErrors errors recorded since creation or the last clear
 * @param errorsByCode counts keyed by protocol code
 * @param recentErrors the most recent entries, oldest first
 * @param errorRate entries recorded within the trailing minute
 */
public record ErrorStatistics(long totalErrors, Map<Integer, Long> errorsByCode, List<ErrorLogEntry> recentErrors,
		long errorRate) {
}
