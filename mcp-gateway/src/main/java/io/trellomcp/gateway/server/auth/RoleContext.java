/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import java.util.Optional;

import io.trellomcp.gateway.spec.McpTransportContext;
import io.trellomcp.gateway.util.Assert;
import jakarta.servlet.ServletRequest;

/**
 * Per-request role binding.
 * <p>
 * The binding is stored as an attribute of the servlet request by the
 * {@link AuthenticationFilter} and copied into the request's
 * {@link McpTransportContext} by the transport. Both carriers live exactly as long as
 * the request they belong to, so a binding can never be observed by a concurrent
 * request. A binding is written once; writing a second role into the same scope fails.
 */
public final class RoleContext {

	/**
	 * Servlet request attribute holding the bound {@link Role}.
	 */
	public static final String REQUEST_ATTRIBUTE = RoleContext.class.getName() + ".ROLE";

	/**
	 * Transport context key holding the bound {@link Role}.
	 */
	public static final String CONTEXT_KEY = "trellomcp.role";

	private RoleContext() {
	}

	public static void bind(ServletRequest request, Role role) {
		Assert.notNull(request, "request must not be null");
		Assert.notNull(role, "role must not be null");
		Object existing = request.getAttribute(REQUEST_ATTRIBUTE);
		if (existing != null) {
			throw new IllegalStateException("A role is already bound to this request: " + existing);
		}
		request.setAttribute(REQUEST_ATTRIBUTE, role);
	}

	public static void bind(McpTransportContext context, Role role) {
		Assert.notNull(context, "context must not be null");
		Assert.notNull(role, "role must not be null");
		Object existing = context.putIfAbsent(CONTEXT_KEY, role);
		if (existing != null) {
			throw new IllegalStateException("A role is already bound to this transport context: " + existing);
		}
	}

	public static Optional<Role> current(ServletRequest request) {
		Object value = request.getAttribute(REQUEST_ATTRIBUTE);
		return value instanceof Role role ? Optional.of(role) : Optional.empty();
	}

	public static Optional<Role> current(McpTransportContext context) {
		if (context == null) {
			return Optional.empty();
		}
		Object value = context.get(CONTEXT_KEY);
		return value instanceof Role role ? Optional.of(role) : Optional.empty();
	}

}
