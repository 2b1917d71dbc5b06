/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

/**
 * Receives session lifecycle events. Callbacks run synchronously on the thread that
 * triggered the event, before the triggering call returns.
 */
public interface SessionListener {

	default void onCreated(ClientSession session) {
	}

	default void onAuthenticated(ClientSession session) {
	}

	default void onDisconnected(ClientSession session, String reason) {
	}

	/**
	 * Called before an expired session is disconnected by the health check.
	 */
	default void onExpired(ClientSession session) {
	}

	default void onCleanupCompleted(int removed) {
	}

}
