/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Per-registration overrides. {@code null} fields keep the value from the definition or
 * the registry configuration.
 *
 * @param enabled overrides {@link ToolDefinition#enabled()}
 * @param category overrides {@link ToolDefinition#category()}
 * @param version overrides {@link ToolDefinition#version()}
 * @param allowOverwrite overrides {@link ToolRegistryConfig#allowOverwrite()}
 * @param metadata entries added to the definition's metadata
 */
public record ToolRegistrationOptions(@Nullable Boolean enabled, @Nullable String category,
		@Nullable String version, @Nullable Boolean allowOverwrite, Map<String, Object> metadata) {

	public static final ToolRegistrationOptions DEFAULT = new ToolRegistrationOptions(null, null, null, null,
			Map.of());

	public ToolRegistrationOptions {
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	public static ToolRegistrationOptions overwrite() {
		return new ToolRegistrationOptions(null, null, null, true, Map.of());
	}

}
