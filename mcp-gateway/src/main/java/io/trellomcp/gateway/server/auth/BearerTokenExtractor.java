/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import java.util.Locale;

/**
 * Extracts bearer tokens from HTTP {@code Authorization} header values.
 */
public final class BearerTokenExtractor {

	private static final String BEARER_PREFIX = "bearer ";

	private BearerTokenExtractor() {
	}

	/**
	 * Extracts the token from a {@code Bearer <token>} header value. The scheme is
	 * matched case-insensitively.
	 * @param authorizationHeader the header value, may be {@code null}
	 * @return the trimmed token, or the empty string if the header is missing or
	 * malformed
	 */
	public static String extract(String authorizationHeader) {
		if (authorizationHeader == null) {
			return "";
		}
		String trimmed = authorizationHeader.strip();
		if (trimmed.length() < BEARER_PREFIX.length()
				|| !trimmed.substring(0, BEARER_PREFIX.length()).toLowerCase(Locale.ROOT).equals(BEARER_PREFIX)) {
			return "";
		}
		return trimmed.substring(BEARER_PREFIX.length()).strip();
	}

	/**
	 * Renders a token for diagnostics without exposing it: at most the first four
	 * characters followed by an ellipsis.
	 * @param token the token, may be {@code null}
	 * @return a short, non-identifying prefix
	 */
	public static String redact(String token) {
		if (token == null || token.isEmpty()) {
			return "<empty>";
		}
		if (token.length() <= 8) {
			return "****";
		}
		return token.substring(0, 4) + "...";
	}

}
