/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.spec;

import reactor.core.publisher.Mono;

/**
 * Server side of a single client connection. A transport delivers raw inbound messages to
 * the router and writes the serialized replies back to the client.
 */
public interface McpServerTransport {

	/**
	 * The kind of channel this transport represents.
	 * @return the transport kind
	 */
	TransportKind kind();

	/**
	 * Sends a serialized JSON-RPC message to the client.
	 * @param message the JSON text to write
	 * @return a {@link Mono} that completes when the message has been written
	 */
	Mono<Void> sendMessage(String message);

	/**
	 * Closes the transport connection and releases any associated resources
	 * asynchronously.
	 * @return a {@link Mono} that completes when the connection has been closed
	 */
	Mono<Void> closeGracefully();

	/**
	 * Closes the transport connection immediately.
	 */
	default void close() {
		this.closeGracefully().subscribe();
	}

}
