/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Liveness endpoint. Answers every method with {@code 200} and a small JSON document;
 * it is exempt from authentication.
 */
public class HealthServlet extends HttpServlet {

	private static final long serialVersionUID = 1L;

	private final transient ObjectMapper objectMapper;

	public HealthServlet(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	protected void service(HttpServletRequest request, HttpServletResponse response) throws IOException {
		Map<String, String> body = new LinkedHashMap<>();
		body.put("status", "ok");
		body.put("path", request.getRequestURI());
		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType("application/json");
		response.setCharacterEncoding("UTF-8");
		response.getWriter().write(this.objectMapper.writeValueAsString(body));
	}

}
