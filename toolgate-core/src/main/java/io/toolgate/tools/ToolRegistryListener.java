/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

/**
 * Receives registry events synchronously, before the triggering call returns.
 */
public interface ToolRegistryListener {

	default void onToolRegistered(ToolDefinition tool) {
	}

	default void onToolUnregistered(String name) {
	}

	default void onToolEnabled(String name, boolean enabled) {
	}

	default void onToolExecuted(String name, ToolResult result) {
	}

}
