/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.session;

import java.util.Set;

import io.toolgate.util.Assert;

/**
 * The authenticated identity behind a session.
 *
 * @param userId stable user identifier
 * @param permissions permission names granted to the user
 * @param groups groups the user belongs to
 * @param level coarse permission level
 */
public record UserContext(String userId, Set<String> permissions, Set<String> groups, PermissionLevel level) {

	public UserContext {
		Assert.hasText(userId, "userId must not be empty");
		permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
		groups = groups == null ? Set.of() : Set.copyOf(groups);
		level = level == null ? PermissionLevel.NONE : level;
	}

}
