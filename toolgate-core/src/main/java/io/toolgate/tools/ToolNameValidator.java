/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates tool names.
 *
 * <p>
 * Tool names must conform to the following rules:
 * <ul>
 * <li>Must be between 2 and 50 characters in length</li>
 * <li>Must start with a lowercase letter and may only contain lowercase letters, digits
 * and underscores</li>
 * <li>Must not start with a reserved prefix ({@code bitbucket_}, {@code mcp_},
 * {@code bb_})</li>
 * <li>Must not be a reserved word such as {@code list} or {@code call}</li>
 * </ul>
 */
public final class ToolNameValidator {

	private static final int MIN_LENGTH = 2;

	private static final int MAX_LENGTH = 50;

	private static final Pattern VALID_NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

	public static final List<String> FORBIDDEN_PREFIXES = List.of("bitbucket_", "mcp_", "bb_");

	public static final Set<String> RESERVED_NAMES = Set.of("list", "call", "initialize", "shutdown", "ping",
			"help");

	private ToolNameValidator() {
	}

	/**
	 * Validates a tool name.
	 * @param name the tool name to validate
	 * @throws IllegalArgumentException if validation fails
	 */
	public static void validate(String name) {
		if (name == null || name.isEmpty()) {
			handleError("Tool name must not be null or empty", name);
		}
		if (name.length() < MIN_LENGTH || name.length() > MAX_LENGTH) {
			handleError("Tool name must be between " + MIN_LENGTH + " and " + MAX_LENGTH + " characters", name);
		}
		if (!VALID_NAME_PATTERN.matcher(name).matches()) {
			handleError("Tool name must match " + VALID_NAME_PATTERN.pattern(), name);
		}
		for (String prefix : FORBIDDEN_PREFIXES) {
			if (name.startsWith(prefix)) {
				handleError("Tool name must not start with the reserved prefix '" + prefix + "'", name);
			}
		}
		if (RESERVED_NAMES.contains(name)) {
			handleError("Tool name is reserved", name);
		}
	}

	public static boolean isValid(String name) {
		try {
			validate(name);
			return true;
		}
		catch (IllegalArgumentException e) {
			return false;
		}
	}

	private static void handleError(String message, String name) {
		throw new IllegalArgumentException(message + ": '" + name + "'");
	}

}
