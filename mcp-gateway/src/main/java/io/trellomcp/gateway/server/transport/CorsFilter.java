/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.io.IOException;

import io.trellomcp.gateway.spec.HttpHeaders;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Permissive CORS handling for browser based MCP clients. Every origin is allowed and
 * echoed back so that credentials can be sent. Pre-flight requests are answered here
 * and never reach authentication.
 */
public class CorsFilter implements Filter {

	static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";

	static final String ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";

	static final String ALLOW_METHODS = "Access-Control-Allow-Methods";

	static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";

	static final String EXPOSE_HEADERS = "Access-Control-Expose-Headers";

	static final String MAX_AGE = "Access-Control-Max-Age";

	static final String REQUEST_METHOD = "Access-Control-Request-Method";

	static final String REQUEST_HEADERS = "Access-Control-Request-Headers";

	private static final String DEFAULT_METHODS = "GET, POST, DELETE, OPTIONS";

	@Override
	public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
			throws IOException, ServletException {
		if (!(request instanceof HttpServletRequest httpRequest)
				|| !(response instanceof HttpServletResponse httpResponse)) {
			chain.doFilter(request, response);
			return;
		}

		String origin = httpRequest.getHeader(HttpHeaders.ORIGIN);
		if (origin != null) {
			httpResponse.setHeader(ALLOW_ORIGIN, origin);
			httpResponse.setHeader(ALLOW_CREDENTIALS, "true");
			httpResponse.setHeader(EXPOSE_HEADERS, HttpHeaders.MCP_SESSION_ID);
			httpResponse.addHeader("Vary", "Origin");
		}

		if ("OPTIONS".equalsIgnoreCase(httpRequest.getMethod()) && httpRequest.getHeader(REQUEST_METHOD) != null) {
			String requestedHeaders = httpRequest.getHeader(REQUEST_HEADERS);
			httpResponse.setHeader(ALLOW_METHODS, DEFAULT_METHODS);
			httpResponse.setHeader(ALLOW_HEADERS, requestedHeaders != null ? requestedHeaders : "*");
			httpResponse.setHeader(MAX_AGE, "86400");
			httpResponse.setStatus(HttpServletResponse.SC_OK);
			return;
		}

		chain.doFilter(request, response);
	}

}
