/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthenticationFilterTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final CredentialStore store = CredentialStore.fromLists("ro-key", "rw-key", null);

	private final AuthenticationFilter filter = new AuthenticationFilter(this.store, List.of("/health", "/healthz"),
			this.objectMapper);

	private HttpServletRequest request;

	private HttpServletResponse response;

	private FilterChain chain;

	private StringWriter body;

	@BeforeEach
	void setUp() throws Exception {
		this.request = mock(HttpServletRequest.class);
		this.response = mock(HttpServletResponse.class);
		this.chain = mock(FilterChain.class);
		this.body = new StringWriter();
		when(this.request.getDispatcherType()).thenReturn(DispatcherType.REQUEST);
		when(this.request.getMethod()).thenReturn("POST");
		when(this.request.getRequestURI()).thenReturn("/mcp");
		when(this.request.getServletPath()).thenReturn("/mcp");
		when(this.response.getWriter()).thenReturn(new PrintWriter(this.body));
	}

	@Test
	void rejectsMissingToken() throws Exception {
		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.response).setStatus(401);
		verify(this.response).setHeader("WWW-Authenticate", "Bearer");
		verify(this.chain, never()).doFilter(any(), any());
		JsonNode json = this.objectMapper.readTree(this.body.toString());
		assertThat(json.get("error").asText()).isEqualTo("unauthorized");
		assertThat(json.get("message").asText()).isEqualTo("Missing bearer token");
	}

	@Test
	void rejectsUnknownToken() throws Exception {
		when(this.request.getHeader("Authorization")).thenReturn("Bearer not-a-key");

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.response).setStatus(401);
		verify(this.chain, never()).doFilter(any(), any());
		assertThat(this.body.toString()).contains("Invalid API key").doesNotContain("not-a-key");
	}

	@Test
	void bindsReadOnlyRoleAndContinues() throws Exception {
		when(this.request.getHeader("Authorization")).thenReturn("Bearer ro-key");

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.request).setAttribute(RoleContext.REQUEST_ATTRIBUTE, Role.READ_ONLY);
		verify(this.chain).doFilter(this.request, this.response);
		verify(this.response, never()).setStatus(401);
	}

	@Test
	void bindsReadWriteRoleAndContinues() throws Exception {
		when(this.request.getHeader("Authorization")).thenReturn("bearer rw-key");

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.request).setAttribute(RoleContext.REQUEST_ATTRIBUTE, Role.READ_WRITE);
		verify(this.chain).doFilter(this.request, this.response);
	}

	@Test
	void healthPathsBypassAuthentication() throws Exception {
		when(this.request.getMethod()).thenReturn("GET");
		when(this.request.getRequestURI()).thenReturn("/healthz");
		when(this.request.getServletPath()).thenReturn("/healthz");

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.chain).doFilter(this.request, this.response);
		verify(this.request, never()).setAttribute(any(), any());
	}

	@Test
	void healthSubPathsBypassAuthentication() throws Exception {
		when(this.request.getMethod()).thenReturn("GET");
		when(this.request.getRequestURI()).thenReturn("/health/live");
		when(this.request.getServletPath()).thenReturn("/health");
		when(this.request.getPathInfo()).thenReturn("/live");

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.chain).doFilter(this.request, this.response);
	}

	@Test
	void dotSegmentsThroughHealthPathStillRequireCredentials() throws Exception {
		when(this.request.getRequestURI()).thenReturn("/health/../mcp");
		when(this.request.getServletPath()).thenReturn("/mcp");

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.response).setStatus(401);
		verify(this.chain, never()).doFilter(any(), any());
	}

	@Test
	void openAccessGrantsReadWriteWithoutHeader() throws Exception {
		AuthenticationFilter openFilter = new AuthenticationFilter(CredentialStore.fromLists(null, null, null),
				List.of("/health"), this.objectMapper);

		openFilter.doFilter(this.request, this.response, this.chain);

		verify(this.request).setAttribute(RoleContext.REQUEST_ATTRIBUTE, Role.READ_WRITE);
		verify(this.chain).doFilter(this.request, this.response);
		verify(this.response, never()).setStatus(401);
	}

	@Test
	void preflightBypassesAuthentication() throws Exception {
		when(this.request.getMethod()).thenReturn("OPTIONS");

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.chain).doFilter(this.request, this.response);
		verify(this.response, never()).setStatus(401);
	}

	@Test
	void asyncRedispatchKeepsExistingBinding() throws Exception {
		when(this.request.getDispatcherType()).thenReturn(DispatcherType.ASYNC);
		when(this.request.getAttribute(RoleContext.REQUEST_ATTRIBUTE)).thenReturn(Role.READ_ONLY);

		this.filter.doFilter(this.request, this.response, this.chain);

		verify(this.chain).doFilter(this.request, this.response);
		verify(this.request, never()).setAttribute(any(), any());
	}

	@Test
	void exemptPathMatching() {
		assertThat(this.filter.isExempt("/health")).isTrue();
		assertThat(this.filter.isExempt("/health/live")).isTrue();
		assertThat(this.filter.isExempt("/healthcheck")).isFalse();
		assertThat(this.filter.isExempt("/mcp")).isFalse();
	}

}
