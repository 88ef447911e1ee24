/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

/**
 * Thrown when a mutating operation is invoked without the {@link Role#READ_WRITE}
 * role.
 */
public class PermissionDeniedException extends RuntimeException {

	private final String operation;

	private final Role requiredRole;

	private final Role actualRole;

	public PermissionDeniedException(String operation, Role requiredRole, Role actualRole) {
		super("Tool '" + operation + "' requires " + requiredRole.value() + " access. Your current API key only has "
				+ describe(actualRole) + " access.");
		this.operation = operation;
		this.requiredRole = requiredRole;
		this.actualRole = actualRole;
	}

	public String getOperation() {
		return this.operation;
	}

	public Role getRequiredRole() {
		return this.requiredRole;
	}

	/**
	 * @return the caller's role, or {@code null} if no role was bound
	 */
	public Role getActualRole() {
		return this.actualRole;
	}

	private static String describe(Role role) {
		return role != null ? role.value() : "none";
	}

}
