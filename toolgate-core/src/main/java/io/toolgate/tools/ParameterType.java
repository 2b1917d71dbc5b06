/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * JSON types a tool parameter may declare.
 */
public enum ParameterType {

	STRING("string"), NUMBER("number"), BOOLEAN("boolean"), OBJECT("object"), ARRAY("array");

	private final String jsonType;

	ParameterType(String jsonType) {
		this.jsonType = jsonType;
	}

	@JsonValue
	public String jsonType() {
		return jsonType;
	}

	/**
	 * Whether a decoded JSON value conforms to this type.
	 */
	public boolean matches(Object value) {
		return switch (this) {
			case STRING -> value instanceof String;
			case NUMBER -> value instanceof Number;
			case BOOLEAN -> value instanceof Boolean;
			case OBJECT -> value instanceof Map;
			case ARRAY -> value instanceof List || (value != null && value.getClass().isArray());
		};
	}

}
