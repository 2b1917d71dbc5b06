/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import io.toolgate.session.ClientSession;
import io.toolgate.session.UserContext;
import io.toolgate.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * What a tool knows about the call it is serving.
 *
 * @param session the invoking session
 * @param user the authenticated user, {@code null} for anonymous sessions
 * @param requestId id of the JSON-RPC request
 * @param requestTimestamp epoch millis at which the request was received
 */
public record ToolExecutionContext(ClientSession session, @Nullable UserContext user, @Nullable Object requestId,
		long requestTimestamp) {

	public ToolExecutionContext {
		Assert.notNull(session, "session must not be null");
	}

	public static ToolExecutionContext of(ClientSession session, @Nullable Object requestId) {
		return new ToolExecutionContext(session, session.getUser(), requestId, System.currentTimeMillis());
	}

}
