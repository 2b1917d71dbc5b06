/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import java.util.Map;

import io.toolgate.session.ClientSession;

/**
 * Receives router events synchronously on the routing thread.
 */
public interface RouterListener {

	default void onClientInitialized(ClientSession session) {
	}

	default void onNotification(ClientSession session, String method, Map<String, Object> params) {
	}

	default void onShutdownRequested(ClientSession session) {
	}

}
