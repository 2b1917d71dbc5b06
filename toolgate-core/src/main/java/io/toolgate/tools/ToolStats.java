/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

/**
 * Execution counters of one tool.
 *
 * @param name the tool name
 * @param executions completed executions
 * @param successes executions that returned a successful result
 * @param failures executions that failed for any reason
 * @param averageExecutionTime mean execution time in milliseconds
 * @param lastExecuted epoch millis of the last execution, 0 when never run
 */
public record ToolStats(String name, long executions, long successes, long failures, double averageExecutionTime,
		long lastExecuted) {

	static ToolStats empty(String name) {
		return new ToolStats(name, 0, 0, 0, 0, 0);
	}

	ToolStats record(boolean success, long executionTime, long now) {
		long total = executions + 1;
		double average = (averageExecutionTime * executions + executionTime) / total;
		return new ToolStats(name, total, success ? successes + 1 : successes, success ? failures : failures + 1,
				average, now);
	}

}
