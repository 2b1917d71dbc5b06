/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import io.toolgate.session.ClientSession;
import io.toolgate.util.Assert;

/**
 * Per-message routing context supplied by a transport.
 *
 * @param session the session of the connection the message arrived on
 * @param receivedAt epoch millis at which the transport read the message
 */
public record MessageContext(ClientSession session, long receivedAt) {

	public MessageContext {
		Assert.notNull(session, "session must not be null");
	}

	public static MessageContext of(ClientSession session) {
		return new MessageContext(session, System.currentTimeMillis());
	}

}
