/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import java.util.List;

import io.toolgate.spec.McpSchema.JSONRPCResponse;

/**
 * What the router sends back for one inbound payload: a single response or the responses
 * of a batch, in request order.
 */
public sealed interface RouterReply permits RouterReply.Single, RouterReply.Batch {

	/**
	 * The value to serialize onto the wire.
	 */
	Object payload();

	record Single(JSONRPCResponse response) implements RouterReply {

		@Override
		public Object payload() {
			return response;
		}

	}

	record Batch(List<JSONRPCResponse> responses) implements RouterReply {

		public Batch {
			responses = List.copyOf(responses);
		}

		@Override
		public Object payload() {
			return responses;
		}

	}

}
