/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Test;

class McpErrorTest {

	@Test
	void testBuilder() {
		McpError error = McpError.builder(McpSchema.ErrorCodes.TOOL_NOT_FOUND)
			.message("Tool not found: missing")
			.data(Map.of("toolName", "missing"))
			.build();

		assertThat(error.getCode()).isEqualTo(-32001);
		assertThat(error.getMessage()).isEqualTo("Tool not found: missing");
		assertThat(error.getJsonRpcError().data()).isEqualTo(Map.of("toolName", "missing"));
	}

	@Test
	void testBuilderRequiresMessage() {
		assertThatThrownBy(() -> McpError.builder(McpSchema.ErrorCodes.INTERNAL_ERROR).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testErrorCodeTable() {
		assertThat(McpSchema.ErrorCodes.PARSE_ERROR).isEqualTo(-32700);
		assertThat(McpSchema.ErrorCodes.INVALID_REQUEST).isEqualTo(-32600);
		assertThat(McpSchema.ErrorCodes.METHOD_NOT_FOUND).isEqualTo(-32601);
		assertThat(McpSchema.ErrorCodes.INVALID_PARAMS).isEqualTo(-32602);
		assertThat(McpSchema.ErrorCodes.INTERNAL_ERROR).isEqualTo(-32603);
		assertThat(McpSchema.ErrorCodes.INITIALIZATION_FAILED).isEqualTo(-32000);
		assertThat(McpSchema.ErrorCodes.TOOL_EXECUTION_FAILED).isEqualTo(-32002);
		assertThat(McpSchema.ErrorCodes.TRANSPORT_ERROR).isEqualTo(-32003);
		assertThat(McpSchema.ErrorCodes.SESSION_EXPIRED).isEqualTo(-32004);
		assertThat(McpSchema.ErrorCodes.RATE_LIMIT_EXCEEDED).isEqualTo(-32005);
		assertThat(McpSchema.ErrorCodes.AUTHENTICATION_FAILED).isEqualTo(-32006);
		assertThat(McpSchema.ErrorCodes.AUTHORIZATION_FAILED).isEqualTo(-32007);
		assertThat(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND).isEqualTo(-32008);
		assertThat(McpSchema.ErrorCodes.CONCURRENT_OPERATION).isEqualTo(-32009);
		assertThat(McpSchema.ErrorCodes.MEMORY_LIMIT_EXCEEDED).isEqualTo(-32010);
	}

}
