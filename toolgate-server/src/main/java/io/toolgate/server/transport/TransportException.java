/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.transport;

/**
 * Raised when a transport cannot read from or write to its channel.
 */
public class TransportException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public TransportException(String message) {
		super(message);
	}

	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
