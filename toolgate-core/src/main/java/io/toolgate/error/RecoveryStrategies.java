/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static table of recovery suggestions per {@link ErrorKind}. Kinds that are not listed
 * carry no suggestions.
 */
public final class RecoveryStrategies {

	private static final Map<ErrorKind, List<RecoveryStrategy>> STRATEGIES = new EnumMap<>(ErrorKind.class);

	static {
		STRATEGIES.put(ErrorKind.SESSION_EXPIRED,
				List.of(RecoveryStrategy.automatic("refresh_session", "Attempt to refresh the session", Map.of()),
						RecoveryStrategy.manual("re_authenticate", "Re-authenticate with the server")));
		STRATEGIES.put(ErrorKind.TOKEN_EXPIRED,
				List.of(RecoveryStrategy.automatic("refresh_token", "Refresh the access token", Map.of())));
		STRATEGIES.put(ErrorKind.AUTHENTICATION_FAILED,
				List.of(RecoveryStrategy.manual("authenticate", "Provide valid credentials and authenticate")));
		STRATEGIES.put(ErrorKind.AUTHORIZATION_FAILED,
				List.of(RecoveryStrategy.manual("request_permissions", "Request the required permissions"),
						RecoveryStrategy.manual("use_different_account", "Use an account with sufficient access")));
		STRATEGIES.put(ErrorKind.NETWORK_ERROR, List.of(RecoveryStrategy.automatic("retry",
				"Retry the request after a short delay", Map.of("maxRetries", 3, "delay", 1000))));
		STRATEGIES.put(ErrorKind.TIMEOUT, List.of(RecoveryStrategy.automatic("retry",
				"Retry the request with a longer deadline", Map.of("maxRetries", 2, "delay", 2000))));
		STRATEGIES.put(ErrorKind.RATE_LIMIT_EXCEEDED, List.of(RecoveryStrategy.automatic("wait_and_retry",
				"Wait before retrying the request", Map.of("waitTime", 60000))));
	}

	private RecoveryStrategies() {
	}

	/**
	 * Returns the suggestions registered for a kind.
	 * @param kind the error kind
	 * @return an immutable, possibly empty list
	 */
	public static List<RecoveryStrategy> forKind(ErrorKind kind) {
		return STRATEGIES.getOrDefault(kind, List.of());
	}

}
