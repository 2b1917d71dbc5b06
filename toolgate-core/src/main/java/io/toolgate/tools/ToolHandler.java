/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * The executable part of a tool.
 */
@FunctionalInterface
public interface ToolHandler {

	/**
	 * Runs the tool.
	 * @param arguments validated arguments with defaults applied
	 * @param context the invoking session and user
	 * @return the result; an error signal is reported to the client as a failed execution
	 */
	Mono<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context);

}
