/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

import java.util.LinkedHashMap;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Where an error happened: the originating request and session, the operation tag and
 * free-form details.
 *
 * @param requestId id of the request being processed, if any
 * @param sessionId id of the session the request belongs to, if any
 * @param operation operation tag such as {@code tools/call}
 * @param details arbitrary additional context
 */
public record ErrorContext(@Nullable Object requestId, @Nullable String sessionId, @Nullable String operation,
		Map<String, Object> details) {

	public static final ErrorContext EMPTY = new ErrorContext(null, null, null, Map.of());

	public ErrorContext {
		details = details == null ? Map.of() : Map.copyOf(details);
	}

	public static ErrorContext of(String operation) {
		return new ErrorContext(null, null, operation, Map.of());
	}

	public ErrorContext withDetail(String key, Object value) {
		if (value == null) {
			return this;
		}
		Map<String, Object> merged = new LinkedHashMap<>(this.details);
		merged.put(key, value);
		return new ErrorContext(this.requestId, this.sessionId, this.operation, merged);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private Object requestId;

		private String sessionId;

		private String operation;

		private final Map<String, Object> details = new LinkedHashMap<>();

		public Builder requestId(Object requestId) {
			this.requestId = requestId;
			return this;
		}

		public Builder sessionId(String sessionId) {
			this.sessionId = sessionId;
			return this;
		}

		public Builder operation(String operation) {
			this.operation = operation;
			return this;
		}

		public Builder detail(String key, Object value) {
			if (value != null) {
				this.details.put(key, value);
			}
			return this;
		}

		public ErrorContext build() {
			return new ErrorContext(requestId, sessionId, operation, details);
		}

	}

}
