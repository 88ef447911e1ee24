/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.util.Locale;
import java.util.Set;

import io.trellomcp.gateway.util.Utils;

/**
 * Decides which responses receive the stream integrity headers.
 */
public enum HeaderInjectionPolicy {

	/**
	 * Inject on every response of the MCP endpoint.
	 */
	PERMISSIVE,

	/**
	 * Inject only on streaming responses.
	 */
	STRICT;

	private static final Set<String> STREAMING_MEDIA_TYPES = Set.of("text/event-stream", "application/x-ndjson");

	/**
	 * Whether a response with the given content type should carry the headers.
	 * @param contentType the response content type, may be {@code null}
	 * @return {@code true} if the headers must be injected
	 */
	public boolean appliesTo(String contentType) {
		if (this == PERMISSIVE) {
			return true;
		}
		for (String mediaType : STREAMING_MEDIA_TYPES) {
			if (Utils.isMediaType(contentType, mediaType)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Parses a configuration value, ignoring case and surrounding whitespace.
	 * @param value {@code permissive} or {@code strict}; blank selects
	 * {@link #PERMISSIVE}
	 * @return the policy
	 * @throws IllegalArgumentException for any other value
	 */
	public static HeaderInjectionPolicy parse(String value) {
		if (!Utils.hasText(value)) {
			return PERMISSIVE;
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT);
		for (HeaderInjectionPolicy policy : values()) {
			if (policy.name().equals(normalized)) {
				return policy;
			}
		}
		throw new IllegalArgumentException(
				"Unknown stream header policy '" + value + "', expected 'permissive' or 'strict'");
	}

}
