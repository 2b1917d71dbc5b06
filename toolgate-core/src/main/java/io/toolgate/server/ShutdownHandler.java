/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server;

import reactor.core.publisher.Mono;

/**
 * Stops the server after a client requested {@code shutdown}.
 */
@FunctionalInterface
public interface ShutdownHandler {

	ShutdownHandler NOOP = Mono::empty;

	Mono<Void> shutdown();

}
