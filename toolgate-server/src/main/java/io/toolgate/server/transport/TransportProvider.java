/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.transport;

import java.io.IOException;

import io.toolgate.spec.TransportKind;
import reactor.core.publisher.Mono;

/**
 * Accepts client connections on some channel and hands each of them to a
 * {@link ConnectionHandler}.
 */
public interface TransportProvider {

	TransportKind kind();

	/**
	 * Starts accepting connections. Returns once the channel is ready; connections are
	 * served on the provider's own threads.
	 * @param handler serves each accepted connection
	 * @throws IOException if the channel cannot be opened
	 */
	void start(ConnectionHandler handler) throws IOException;

	/**
	 * Completes when the provider stops accepting connections, either because its input
	 * ended or because it was closed.
	 */
	Mono<Void> onTermination();

	/**
	 * Stops accepting connections and releases the channel.
	 */
	Mono<Void> closeGracefully();

}
