/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import reactor.util.annotation.Nullable;

/**
 * Outcome of a tool execution.
 *
 * @param success whether the tool completed normally
 * @param data the tool output, when successful
 * @param error the failure, when not successful
 * @param metadata timing information filled in by the registry
 */
public record ToolResult(boolean success, @Nullable Object data, @Nullable ToolError error,
		@Nullable ExecutionMetadata metadata) {

	public static ToolResult success(@Nullable Object data) {
		return new ToolResult(true, data, null, null);
	}

	public static ToolResult failure(ToolError error) {
		return new ToolResult(false, null, error, null);
	}

	ToolResult withMetadata(ExecutionMetadata metadata) {
		return new ToolResult(success, data, error, metadata);
	}

	/**
	 * @param executionTime milliseconds spent in the registry for this call
	 * @param timestamp epoch millis at which the call completed
	 */
	public record ExecutionMetadata(long executionTime, long timestamp) {
	}

}
