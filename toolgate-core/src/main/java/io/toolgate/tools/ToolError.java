/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import io.toolgate.spec.McpError;

/**
 * Why a tool call did not succeed.
 *
 * @param code protocol error code
 * @param message single line description, never a stack trace
 * @param details structured error data sent to the client
 */
public record ToolError(int code, String message, Object details) {

	public static ToolError from(McpError error) {
		return new ToolError(error.getJsonRpcError().code(), error.getJsonRpcError().message(),
				error.getJsonRpcError().data());
	}

}
