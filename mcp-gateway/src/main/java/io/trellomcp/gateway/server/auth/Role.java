/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

/**
 * Coarse-grained access level resolved from a bearer credential.
 */
public enum Role {

	READ_ONLY("read_only"),

	READ_WRITE("read_write");

	private final String value;

	Role(String value) {
		this.value = value;
	}

	/**
	 * The wire name of the role, e.g. {@code read_only}.
	 * @return the role name used in logs and error messages
	 */
	public String value() {
		return this.value;
	}

	/**
	 * Whether callers with this role may mutate remote state.
	 * @return {@code true} only for {@link #READ_WRITE}
	 */
	public boolean canWrite() {
		return this == READ_WRITE;
	}

}
