/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.error;

import io.toolgate.spec.McpSchema.ErrorCodes;

/**
 * Severity of a protocol error. Only selects the level an error is logged at.
 */
public enum ErrorSeverity {

	LOW, MEDIUM, HIGH, CRITICAL;

	/**
	 * Classifies a protocol error code.
	 * @param code the JSON-RPC error code
	 * @return the severity, {@link #MEDIUM} for codes outside the known table
	 */
	public static ErrorSeverity of(int code) {
		switch (code) {
			case ErrorCodes.PARSE_ERROR:
			case ErrorCodes.INVALID_REQUEST:
			case ErrorCodes.INVALID_PARAMS:
				return LOW;
			case ErrorCodes.METHOD_NOT_FOUND:
			case ErrorCodes.TOOL_NOT_FOUND:
			case ErrorCodes.RESOURCE_NOT_FOUND:
				return MEDIUM;
			case ErrorCodes.TOOL_EXECUTION_FAILED:
			case ErrorCodes.TRANSPORT_ERROR:
			case ErrorCodes.SESSION_EXPIRED:
			case ErrorCodes.RATE_LIMIT_EXCEEDED:
				return HIGH;
			case ErrorCodes.INTERNAL_ERROR:
			case ErrorCodes.INITIALIZATION_FAILED:
			case ErrorCodes.MEMORY_LIMIT_EXCEEDED:
			case ErrorCodes.AUTHENTICATION_FAILED:
			case ErrorCodes.AUTHORIZATION_FAILED:
				return CRITICAL;
			default:
				return MEDIUM;
		}
	}

}
