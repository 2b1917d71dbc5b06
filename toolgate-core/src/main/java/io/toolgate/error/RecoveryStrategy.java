/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A suggested remediation attached to an error response.
 *
 * @param action machine readable action tag, for example {@code retry}
 * @param description human readable guidance
 * @param automatic whether a client may apply the action without user input
 * @param parameters action parameters such as {@code maxRetries} or {@code delay}
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RecoveryStrategy( // @formatter:off
	@JsonProperty("action") String action,
	@JsonProperty("description") String description,
	@JsonProperty("automatic") boolean automatic,
	@JsonProperty("parameters") Map<String, Object> parameters) { // @formatter:on

	public RecoveryStrategy {
		parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
	}

	public static RecoveryStrategy automatic(String action, String description, Map<String, Object> parameters) {
		return new RecoveryStrategy(action, description, true, parameters);
	}

	public static RecoveryStrategy manual(String action, String description) {
		return new RecoveryStrategy(action, description, false, Map.of());
	}

}
