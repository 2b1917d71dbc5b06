/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

import io.toolgate.spec.McpSchema.ErrorCodes;

/**
 * Domain failure kinds and the protocol code each one is reported with.
 */
public enum ErrorKind {

	AUTHENTICATION_FAILED(ErrorCodes.AUTHENTICATION_FAILED),

	SESSION_EXPIRED(ErrorCodes.SESSION_EXPIRED),

	TOKEN_EXPIRED(ErrorCodes.SESSION_EXPIRED),

	INVALID_TOKEN(ErrorCodes.AUTHENTICATION_FAILED),

	NETWORK_ERROR(ErrorCodes.TRANSPORT_ERROR),

	TIMEOUT(ErrorCodes.TOOL_EXECUTION_FAILED),

	RATE_LIMIT_EXCEEDED(ErrorCodes.RATE_LIMIT_EXCEEDED),

	AUTHORIZATION_FAILED(ErrorCodes.AUTHORIZATION_FAILED),

	INTERNAL(ErrorCodes.INTERNAL_ERROR);

	private final int code;

	ErrorKind(int code) {
		this.code = code;
	}

	public int code() {
		return code;
	}

}
