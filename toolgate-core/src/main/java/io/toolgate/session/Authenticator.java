/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Resolves the user behind a session from the credentials a client presents during the
 * handshake.
 */
@FunctionalInterface
public interface Authenticator {

	/**
	 * Accepts every client without an identity.
	 */
	Authenticator ANONYMOUS = (session, authData) -> null;

	/**
	 * Authenticates a session.
	 * @param session the session being authenticated, still in
	 * {@link SessionState#CONNECTING}
	 * @param authData credentials supplied by the client, never {@code null}
	 * @return the resolved user, or {@code null} for an anonymous session
	 * @throws RuntimeException when the credentials are rejected
	 */
	@Nullable
	UserContext authenticate(ClientSession session, Map<String, Object> authData);

}
