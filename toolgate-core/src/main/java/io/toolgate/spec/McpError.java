/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.spec;

import io.toolgate.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.toolgate.util.Assert;

/**
 * Structured protocol failure. Every error that crosses into the protocol layer is
 * represented by an {@code McpError} carrying the {@link JSONRPCError} that is sent to
 * the client.
 */
public class McpError extends RuntimeException {

	private final JSONRPCError jsonRpcError;

	public McpError(JSONRPCError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public JSONRPCError getJsonRpcError() {
		return jsonRpcError;
	}

	/**
	 * Returns the numeric protocol code of this error.
	 * @return the error code
	 */
	public int getCode() {
		return jsonRpcError.code();
	}

	@Override
	public String toString() {
		var message = super.toString();
		if (jsonRpcError.data() != null) {
			message += "\n" + jsonRpcError.data();
		}
		return message;
	}

	public static Builder builder(int errorCode) {
		return new Builder(errorCode);
	}

	public static class Builder {

		private final int code;

		private String message;

		private Object data;

		private Builder(int code) {
			this.code = code;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder data(Object data) {
			this.data = data;
			return this;
		}

		public McpError build() {
			Assert.hasText(message, "message must not be empty");
			return new McpError(new JSONRPCError(code, message, data));
		}

	}

}
