/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.server.cli;

/**
 * Raised when the command line cannot be parsed.
 */
public class CommandLineException extends Exception {

	private static final long serialVersionUID = 1L;

	public CommandLineException(String message) {
		super(message);
	}

}
