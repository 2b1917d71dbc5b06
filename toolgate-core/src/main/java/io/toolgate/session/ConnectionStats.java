/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

import java.util.Map;

/**
 * Snapshot of the session manager's counters.
 *
 * @param activeConnections live sessions
 * @param totalConnections sessions created since start
 * @param totalDisconnections sessions disconnected since start
 * @param connectionsByTransport live sessions per transport id
 * @param averageConnectionDuration mean age of the live sessions in milliseconds
 * @param lastCleanup epoch millis of the last cleanup sweep, 0 when none ran
 */
public record ConnectionStats(int activeConnections, long totalConnections, long totalDisconnections,
		Map<String, Integer> connectionsByTransport, double averageConnectionDuration, long lastCleanup) {

	public static final ConnectionStats EMPTY = new ConnectionStats(0, 0, 0, Map.of(), 0, 0);

}
