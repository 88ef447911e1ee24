/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server;

import io.trellomcp.gateway.server.auth.RoleContext;
import io.trellomcp.gateway.spec.McpTransportContext;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Populates the {@link McpTransportContext} of a request from transport-level metadata.
 *
 * @param <T> the type of the transport request
 */
@FunctionalInterface
public interface McpTransportContextExtractor<T> {

	/**
	 * Fills the given context from the request.
	 * @param request the transport request
	 * @param transportContext a fresh context owned by this request
	 * @return the context handed to the dispatcher
	 */
	McpTransportContext extract(T request, McpTransportContext transportContext);

	/**
	 * Extractor that copies the role bound by the authentication filter.
	 * @return the default servlet extractor
	 */
	static McpTransportContextExtractor<HttpServletRequest> roleBinding() {
		return (request, transportContext) -> {
			RoleContext.current(request).ifPresent(role -> RoleContext.bind(transportContext, role));
			return transportContext;
		};
	}

}
