/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import java.util.function.BiFunction;

import io.trellomcp.gateway.spec.McpSchema.CallToolRequest;
import io.trellomcp.gateway.spec.McpSchema.CallToolResult;
import io.trellomcp.gateway.spec.McpTransportContext;
import io.trellomcp.gateway.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Gate in front of operations that mutate remote state.
 * <p>
 * A guarded handler reads the role bound to the calling request and only delegates when
 * that role is {@link Role#READ_WRITE}. Otherwise the returned {@link Mono} fails with a
 * {@link PermissionDeniedException} and the delegate is never subscribed.
 */
public final class WriteGuard {

	private WriteGuard() {
	}

	/**
	 * Wraps a tool handler so that it only runs for read-write callers.
	 * @param operation the operation name reported on denial
	 * @param handler the handler to protect
	 * @return the guarded handler
	 */
	public static BiFunction<McpTransportContext, CallToolRequest, Mono<CallToolResult>> guard(String operation,
			BiFunction<McpTransportContext, CallToolRequest, Mono<CallToolResult>> handler) {
		Assert.hasText(operation, "operation must not be empty");
		Assert.notNull(handler, "handler must not be null");
		return (context, request) -> Mono.defer(() -> {
			check(operation, context);
			return handler.apply(context, request);
		});
	}

	/**
	 * Verifies that the role bound to {@code context} may mutate remote state.
	 * @param operation the operation name reported on denial
	 * @param context the transport context of the calling request
	 * @throws PermissionDeniedException if the role is missing or read-only
	 */
	public static void check(String operation, McpTransportContext context) {
		Role actual = RoleContext.current(context).orElse(null);
		if (actual == null || !actual.canWrite()) {
			throw new PermissionDeniedException(operation, Role.READ_WRITE, actual);
		}
	}

}
