/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.util;

import java.util.Collection;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null} and does not contain
	 * whitespace only
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Returns the message of the given throwable, falling back to its class name when the
	 * throwable carries no message. Never returns a stack trace.
	 * @param throwable the throwable to describe
	 * @return a single-line description
	 */
	public static String describe(Throwable throwable) {
		if (throwable == null) {
			return "Unknown error";
		}
		return hasText(throwable.getMessage()) ? throwable.getMessage() : throwable.getClass().getSimpleName();
	}

}
