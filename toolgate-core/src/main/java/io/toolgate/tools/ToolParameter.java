/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.LinkedHashMap;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * A declared tool argument.
 *
 * @param name argument name
 * @param type JSON type of the argument
 * @param description human readable description
 * @param required whether callers must supply the argument
 * @param defaultValue value applied when an optional argument is absent
 * @param schema additional JSON Schema constraints, merged into the listed schema
 */
public record ToolParameter(String name, ParameterType type, String description, boolean required,
		@Nullable Object defaultValue, Map<String, Object> schema) {

	public ToolParameter {
		schema = schema == null ? Map.of() : Map.copyOf(schema);
	}

	public static ToolParameter required(String name, ParameterType type, String description) {
		return new ToolParameter(name, type, description, true, null, Map.of());
	}

	public static ToolParameter optional(String name, ParameterType type, String description,
			@Nullable Object defaultValue) {
		return new ToolParameter(name, type, description, false, defaultValue, Map.of());
	}

	public ToolParameter withSchema(String key, Object value) {
		Map<String, Object> merged = new LinkedHashMap<>(this.schema);
		merged.put(key, value);
		return new ToolParameter(name, type, description, required, defaultValue, merged);
	}

	/**
	 * The JSON Schema property describing this argument.
	 */
	Map<String, Object> toSchemaProperty() {
		Map<String, Object> property = new LinkedHashMap<>();
		property.put("type", type.jsonType());
		if (description != null) {
			property.put("description", description);
		}
		if (defaultValue != null) {
			property.put("default", defaultValue);
		}
		property.putAll(schema);
		return property;
	}

}
