/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

/**
 * Response wrapper that merges the stream integrity headers into the response before it
 * is committed.
 * <p>
 * Header values are merged token-wise: existing tokens are kept, missing tokens are
 * appended, and tokens are compared case-insensitively. Applying the headers any number
 * of times therefore yields the same response.
 */
public class StreamIntegrityResponseWrapper extends HttpServletResponseWrapper {

	/**
	 * Headers that keep a streamed response unbuffered through proxies.
	 */
	public static final Map<String, String> STREAM_HEADERS;

	static {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("X-Accel-Buffering", "no");
		headers.put("Cache-Control", "no-cache, no-transform");
		headers.put("Connection", "keep-alive");
		headers.put("Content-Encoding", "identity");
		headers.put("X-Content-Type-Options", "nosniff");
		STREAM_HEADERS = Collections.unmodifiableMap(headers);
	}

	private final HeaderInjectionPolicy policy;

	public StreamIntegrityResponseWrapper(HttpServletResponse response, HeaderInjectionPolicy policy) {
		super(response);
		this.policy = policy;
		applyIfEligible();
	}

	/**
	 * Merges the stream headers into the response if the policy selects it and the
	 * response is not committed yet.
	 * @return {@code true} if the headers were applied
	 */
	public boolean applyIfEligible() {
		if (isCommitted() || !this.policy.appliesTo(getContentType())) {
			return false;
		}
		for (Map.Entry<String, String> header : STREAM_HEADERS.entrySet()) {
			mergeInto(header.getKey(), header.getValue());
		}
		return true;
	}

	@Override
	public void setContentType(String type) {
		super.setContentType(type);
		applyIfEligible();
	}

	@Override
	public void setHeader(String name, String value) {
		if (isStreamHeader(name) && value != null) {
			mergeInto(name, value);
			return;
		}
		super.setHeader(name, value);
		if ("Content-Type".equalsIgnoreCase(name)) {
			applyIfEligible();
		}
	}

	@Override
	public void addHeader(String name, String value) {
		if (isStreamHeader(name) && value != null) {
			mergeInto(name, value);
			return;
		}
		super.addHeader(name, value);
		if ("Content-Type".equalsIgnoreCase(name)) {
			applyIfEligible();
		}
	}

	@Override
	public void reset() {
		super.reset();
		applyIfEligible();
	}

	@Override
	public ServletOutputStream getOutputStream() throws IOException {
		applyIfEligible();
		return super.getOutputStream();
	}

	@Override
	public PrintWriter getWriter() throws IOException {
		applyIfEligible();
		return super.getWriter();
	}

	@Override
	public void flushBuffer() throws IOException {
		applyIfEligible();
		super.flushBuffer();
	}

	private void mergeInto(String name, String value) {
		String existing = joined(getHeaders(name));
		String merged = mergeTokens(existing, value);
		if (!merged.equals(existing) || getHeaders(name).size() > 1) {
			super.setHeader(name, merged);
		}
	}

	private static boolean isStreamHeader(String name) {
		for (String header : STREAM_HEADERS.keySet()) {
			if (header.equalsIgnoreCase(name)) {
				return true;
			}
		}
		return false;
	}

	private static String joined(Collection<String> values) {
		if (values == null || values.isEmpty()) {
			return "";
		}
		return String.join(", ", values);
	}

	/**
	 * Unions two comma separated header values. Tokens of {@code existing} keep their
	 * order and spelling; tokens of {@code added} not already present are appended.
	 * @param existing the current value, may be {@code null} or empty
	 * @param added the value to merge in
	 * @return the merged value
	 */
	public static String mergeTokens(String existing, String added) {
		List<String> tokens = new ArrayList<>();
		List<String> seen = new ArrayList<>();
		for (String source : new String[] { existing, added }) {
			if (source == null) {
				continue;
			}
			for (String token : source.split(",")) {
				String trimmed = token.trim();
				String key = trimmed.toLowerCase(Locale.ROOT);
				if (!trimmed.isEmpty() && !seen.contains(key)) {
					seen.add(key);
					tokens.add(trimmed);
				}
			}
		}
		return String.join(", ", tokens);
	}

}
