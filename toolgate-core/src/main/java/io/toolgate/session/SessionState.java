/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

/**
 * Lifecycle of a client session. States only move forward, in declaration order.
 * {@code CONNECTING -> DISCONNECTING} is the forced termination path.
 */
public enum SessionState {

	CONNECTING, AUTHENTICATED, DISCONNECTING, DISCONNECTED;

	public boolean canTransitionTo(SessionState next) {
		return next.ordinal() > this.ordinal();
	}

	/**
	 * Whether requests may still be routed to a session in this state.
	 */
	public boolean isLive() {
		return this == CONNECTING || this == AUTHENTICATED;
	}

}
