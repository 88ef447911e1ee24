/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.spec.HttpHeaders;
import io.trellomcp.gateway.util.Assert;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Servlet filter that resolves the caller's {@link Role} from the
 * {@code Authorization: Bearer} header and binds it to the request.
 * <p>
 * {@code OPTIONS} requests and the configured health check paths (including their
 * sub-paths) pass through without authentication. Any other request whose credential
 * does not resolve is answered with {@code 401} and a JSON error body, and the rest of
 * the chain is not invoked.
 */
public class AuthenticationFilter implements Filter {

	private static final Logger logger = LoggerFactory.getLogger(AuthenticationFilter.class);

	private static final String APPLICATION_JSON = "application/json";

	private final CredentialStore credentialStore;

	private final List<String> exemptPaths;

	private final ObjectMapper objectMapper;

	public AuthenticationFilter(CredentialStore credentialStore, List<String> exemptPaths, ObjectMapper objectMapper) {
		Assert.notNull(credentialStore, "credentialStore must not be null");
		Assert.notNull(exemptPaths, "exemptPaths must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.credentialStore = credentialStore;
		this.exemptPaths = List.copyOf(exemptPaths);
		this.objectMapper = objectMapper;
	}

	@Override
	public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
			throws IOException, ServletException {
		if (!(request instanceof HttpServletRequest httpRequest)
				|| !(response instanceof HttpServletResponse httpResponse)) {
			chain.doFilter(request, response);
			return;
		}

		// async re-dispatch of an already authenticated request
		if (request.getDispatcherType() == DispatcherType.ASYNC && RoleContext.current(request).isPresent()) {
			chain.doFilter(request, response);
			return;
		}

		if ("OPTIONS".equalsIgnoreCase(httpRequest.getMethod()) || isExempt(pathOf(httpRequest))) {
			chain.doFilter(request, response);
			return;
		}

		String token = BearerTokenExtractor.extract(httpRequest.getHeader(HttpHeaders.AUTHORIZATION));
		Optional<Role> role = this.credentialStore.resolve(token);
		if (role.isEmpty()) {
			logger.warn("Rejected {} {} from {}: {} credential {}", httpRequest.getMethod(), pathOf(httpRequest),
					clientInfo(httpRequest), token.isEmpty() ? "missing" : "unknown",
					BearerTokenExtractor.redact(token));
			sendUnauthorized(httpResponse, token.isEmpty() ? "Missing bearer token" : "Invalid API key");
			return;
		}

		if (this.credentialStore.isOpenAccess()) {
			logger.debug("Open access, granting {} to {} {}", role.get().value(), httpRequest.getMethod(),
					pathOf(httpRequest));
		}
		else {
			logger.debug("Authenticated {} {} as {}", httpRequest.getMethod(), pathOf(httpRequest),
					role.get().value());
		}
		RoleContext.bind(httpRequest, role.get());
		chain.doFilter(request, response);
	}

	boolean isExempt(String path) {
		for (String exempt : this.exemptPaths) {
			if (path.equals(exempt) || path.startsWith(exempt.endsWith("/") ? exempt : exempt + "/")) {
				return true;
			}
		}
		return false;
	}

	private void sendUnauthorized(HttpServletResponse response, String message) throws IOException {
		Map<String, String> body = new LinkedHashMap<>();
		body.put("error", "unauthorized");
		body.put("message", message);
		response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
		response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding("UTF-8");
		response.getWriter().write(this.objectMapper.writeValueAsString(body));
		response.getWriter().flush();
	}

	/**
	 * The path the container routed the request on, after dot-segment and
	 * percent-decoding normalization. Exemptions must match this path and never the raw
	 * request URI, which may differ (e.g. {@code /health/../mcp}).
	 */
	static String pathOf(HttpServletRequest request) {
		String servletPath = request.getServletPath();
		String pathInfo = request.getPathInfo();
		String path = (servletPath != null ? servletPath : "") + (pathInfo != null ? pathInfo : "");
		return path.isEmpty() ? "/" : path;
	}

	private static String clientInfo(HttpServletRequest request) {
		String forwardedFor = request.getHeader("X-Forwarded-For");
		String client = (forwardedFor != null && !forwardedFor.isEmpty()) ? forwardedFor.split(",")[0].trim()
				: request.getRemoteAddr();
		String userAgent = request.getHeader("User-Agent");
		return client + (userAgent != null ? " (" + userAgent + ")" : "");
	}

}
