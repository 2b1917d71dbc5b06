/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.toolgate.spec.McpSchema;

/**
 * Describes a tool: its identity, the arguments it accepts and who may call it.
 *
 * @param name unique tool name
 * @param description human readable description of what the tool does
 * @param category grouping used for discovery
 * @param version semantic version of the tool
 * @param parameters declared arguments, in order
 * @param enabled whether the tool is listed and callable
 * @param authRequirement what a caller needs to run the tool
 * @param metadata free-form registration metadata
 */
public record ToolDefinition(String name, String description, String category, String version,
		List<ToolParameter> parameters, boolean enabled, ToolAuthRequirement authRequirement,
		Map<String, Object> metadata) {

	public static final String DEFAULT_CATEGORY = "general";

	public static final String DEFAULT_VERSION = "1.0.0";

	public ToolDefinition {
		parameters = parameters == null ? null : List.copyOf(parameters);
		authRequirement = authRequirement == null ? ToolAuthRequirement.NONE : authRequirement;
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	public ToolDefinition withEnabled(boolean enabled) {
		return new ToolDefinition(name, description, category, version, parameters, enabled, authRequirement,
				metadata);
	}

	/**
	 * The tool as listed to clients, with an object input schema derived from the
	 * declared parameters.
	 */
	public McpSchema.Tool toListedTool() {
		Map<String, Object> properties = new LinkedHashMap<>();
		List<String> required = new ArrayList<>();
		for (ToolParameter parameter : parameters) {
			properties.put(parameter.name(), parameter.toSchemaProperty());
			if (parameter.required()) {
				required.add(parameter.name());
			}
		}
		return new McpSchema.Tool(name, description, new McpSchema.JsonSchema("object", properties, required));
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String name;

		private String description;

		private String category = DEFAULT_CATEGORY;

		private String version = DEFAULT_VERSION;

		private final List<ToolParameter> parameters = new ArrayList<>();

		private boolean enabled = true;

		private ToolAuthRequirement authRequirement = ToolAuthRequirement.NONE;

		private final Map<String, Object> metadata = new LinkedHashMap<>();

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder category(String category) {
			this.category = category;
			return this;
		}

		public Builder version(String version) {
			this.version = version;
			return this;
		}

		public Builder parameter(ToolParameter parameter) {
			this.parameters.add(parameter);
			return this;
		}

		public Builder parameters(List<ToolParameter> parameters) {
			this.parameters.addAll(parameters);
			return this;
		}

		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		public Builder authRequirement(ToolAuthRequirement authRequirement) {
			this.authRequirement = authRequirement;
			return this;
		}

		public Builder metadata(String key, Object value) {
			this.metadata.put(key, value);
			return this;
		}

		public ToolDefinition build() {
			return new ToolDefinition(name, description, category, version, parameters, enabled, authRequirement,
					metadata);
		}

	}

}
