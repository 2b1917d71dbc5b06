/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

/**
 * Derived per-session statistics.
 *
 * @param duration milliseconds since the session was created
 * @param requestsProcessed messages routed for this session
 * @param toolsCalled tool invocations made by this session
 * @param averageProcessingTime mean processing time in milliseconds
 * @param lastRequest epoch millis of the last routed message, 0 when none
 */
public record SessionStats(long duration, long requestsProcessed, long toolsCalled, double averageProcessingTime,
		long lastRequest) {
}
