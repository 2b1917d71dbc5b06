/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.Map;
import java.util.function.BiFunction;

import io.toolgate.util.Assert;
import reactor.core.publisher.Mono;

/**
 * A tool definition paired with its handler; the unit of registration.
 *
 * <p>
 * Example usage: <pre>{@code
 * ToolSpecification.builder()
 *     .tool(ToolDefinition.builder()
 *         .name("get_status")
 *         .description("Reports the status of an item")
 *         .parameter(ToolParameter.required("id", ParameterType.STRING, "Item id"))
 *         .build())
 *     .syncCallHandler((arguments, context) -> Map.of("id", arguments.get("id"), "status", "ok"))
 *     .build();
 * }</pre>
 *
 * @param definition the tool definition
 * @param handler the function that runs the tool
 */
public record ToolSpecification(ToolDefinition definition, ToolHandler handler) {

	public String name() {
		return definition.name();
	}

	ToolSpecification withDefinition(ToolDefinition definition) {
		return new ToolSpecification(definition, handler);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private ToolDefinition tool;

		private ToolHandler callHandler;

		public Builder tool(ToolDefinition tool) {
			Assert.notNull(tool, "Tool must not be null");
			this.tool = tool;
			return this;
		}

		/**
		 * Sets an asynchronous handler.
		 */
		public Builder callHandler(ToolHandler callHandler) {
			Assert.notNull(callHandler, "Call handler function must not be null");
			this.callHandler = callHandler;
			return this;
		}

		/**
		 * Sets a blocking handler whose return value becomes the successful result data.
		 * The registry runs it off the caller's thread.
		 */
		public Builder syncCallHandler(
				BiFunction<Map<String, Object>, ToolExecutionContext, Object> syncCallHandler) {
			Assert.notNull(syncCallHandler, "Call handler function must not be null");
			this.callHandler = (arguments, context) -> Mono
				.fromCallable(() -> ToolResult.success(syncCallHandler.apply(arguments, context)));
			return this;
		}

		public ToolSpecification build() {
			Assert.notNull(tool, "Tool must not be null");
			return new ToolSpecification(tool, callHandler);
		}

	}

}
