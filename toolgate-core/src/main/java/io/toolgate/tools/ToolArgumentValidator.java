/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks call arguments against a tool's declared parameters.
 */
final class ToolArgumentValidator {

	private ToolArgumentValidator() {
	}

	/**
	 * Validates the arguments and applies the defaults of absent optional parameters.
	 * @return a new argument map
	 * @throws IllegalArgumentException naming the first violation found
	 */
	static Map<String, Object> validate(List<ToolParameter> parameters, Map<String, Object> arguments) {
		Set<String> declared = parameters.stream().map(ToolParameter::name).collect(Collectors.toSet());
		for (String name : arguments.keySet()) {
			if (!declared.contains(name)) {
				throw new IllegalArgumentException("Unknown parameter: " + name);
			}
		}

		Map<String, Object> validated = new LinkedHashMap<>(arguments);
		for (ToolParameter parameter : parameters) {
			Object value = arguments.get(parameter.name());
			if (value == null) {
				if (parameter.required()) {
					throw new IllegalArgumentException("Missing required parameter: " + parameter.name());
				}
				if (parameter.defaultValue() != null) {
					validated.put(parameter.name(), parameter.defaultValue());
				}
				continue;
			}
			if (!parameter.type().matches(value)) {
				throw new IllegalArgumentException("Parameter '" + parameter.name() + "' must be of type "
						+ parameter.type().jsonType());
			}
		}
		return validated;
	}

	/**
	 * Applies defaults without validating, used when validation is switched off.
	 */
	static Map<String, Object> applyDefaults(List<ToolParameter> parameters, Map<String, Object> arguments) {
		Map<String, Object> result = new LinkedHashMap<>(arguments);
		for (ToolParameter parameter : parameters) {
			if (result.get(parameter.name()) == null && parameter.defaultValue() != null) {
				result.put(parameter.name(), parameter.defaultValue());
			}
		}
		return result;
	}

}
