/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

/**
 * Coarse access level of an authenticated user, ordered from least to most privileged.
 */
public enum PermissionLevel {

	NONE, READ, WRITE, ADMIN;

	public boolean isAtLeast(PermissionLevel required) {
		return this.compareTo(required) >= 0;
	}

}
