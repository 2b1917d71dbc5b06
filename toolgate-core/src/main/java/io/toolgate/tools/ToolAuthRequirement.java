/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.toolgate.tools;

import java.util.Set;

import io.toolgate.session.PermissionLevel;

/**
 * What a caller needs to run a tool.
 *
 * @param required whether an authenticated user is needed at all
 * @param permissions permissions the user must hold, all of them
 * @param groups groups the user must belong to, all of them
 * @param minimumLevel lowest acceptable permission level
 */
public record ToolAuthRequirement(boolean required, Set<String> permissions, Set<String> groups,
		PermissionLevel minimumLevel) {

	public static final ToolAuthRequirement NONE = new ToolAuthRequirement(false, Set.of(), Set.of(),
			PermissionLevel.NONE);

	public ToolAuthRequirement {
		permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
		groups = groups == null ? Set.of() : Set.copyOf(groups);
		minimumLevel = minimumLevel == null ? PermissionLevel.NONE : minimumLevel;
	}

	public static ToolAuthRequirement level(PermissionLevel minimumLevel) {
		return new ToolAuthRequirement(true, Set.of(), Set.of(), minimumLevel);
	}

	public static ToolAuthRequirement permissions(String... permissions) {
		return new ToolAuthRequirement(true, Set.of(permissions), Set.of(), PermissionLevel.NONE);
	}

}
