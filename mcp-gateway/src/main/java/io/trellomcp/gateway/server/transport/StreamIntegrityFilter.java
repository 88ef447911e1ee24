/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.io.IOException;
import java.util.Locale;

import io.trellomcp.gateway.util.Assert;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.ServletResponseWrapper;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Servlet filter that wraps responses of the MCP endpoint in a
 * {@link StreamIntegrityResponseWrapper}, so long-lived streams are neither buffered,
 * compressed nor cached by intermediaries.
 * <p>
 * If the response is already wrapped, for instance because the filter is mapped twice,
 * the existing wrapper is reused and the headers are merged again, which leaves the
 * response unchanged.
 */
public class StreamIntegrityFilter implements Filter {

	private static final Logger logger = LoggerFactory.getLogger(StreamIntegrityFilter.class);

	private final HeaderInjectionPolicy policy;

	public StreamIntegrityFilter(HeaderInjectionPolicy policy) {
		Assert.notNull(policy, "policy must not be null");
		this.policy = policy;
		logger.info("Stream integrity headers enabled with {} policy", policy.name().toLowerCase(Locale.ROOT));
	}

	@Override
	public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
			throws IOException, ServletException {
		if (!(response instanceof HttpServletResponse httpResponse)) {
			chain.doFilter(request, response);
			return;
		}
		StreamIntegrityResponseWrapper existing = findWrapper(response);
		if (existing != null) {
			existing.applyIfEligible();
			chain.doFilter(request, response);
			return;
		}
		chain.doFilter(request, new StreamIntegrityResponseWrapper(httpResponse, this.policy));
	}

	private static StreamIntegrityResponseWrapper findWrapper(ServletResponse response) {
		ServletResponse current = response;
		while (current != null) {
			if (current instanceof StreamIntegrityResponseWrapper wrapper) {
				return wrapper;
			}
			current = current instanceof ServletResponseWrapper wrapper ? wrapper.getResponse() : null;
		}
		return null;
	}

}
