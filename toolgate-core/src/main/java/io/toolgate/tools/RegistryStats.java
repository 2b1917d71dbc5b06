/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the registry.
 *
 * @param totalTools registered tools
 * @param enabledTools enabled tools
 * @param disabledTools disabled tools
 * @param totalExecutions executions across all tools
 * @param successfulExecutions successful executions across all tools
 * @param failedExecutions failed executions across all tools
 * @param averageExecutionTime mean execution time across all tools in milliseconds
 * @param toolsByCategory number of tools per category
 * @param mostUsedTools up to ten tools with the most executions, most used first
 */
public record RegistryStats(int totalTools, int enabledTools, int disabledTools, long totalExecutions,
		long successfulExecutions, long failedExecutions, double averageExecutionTime,
		Map<String, Integer> toolsByCategory, List<ToolStats> mostUsedTools) {
}
