/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.util;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Splits a comma separated value into its trimmed, non-empty entries, keeping the
	 * first occurrence of each entry in encounter order.
	 * @param value the raw value, may be {@code null}
	 * @return an ordered set of entries, never {@code null}
	 */
	public static Set<String> commaDelimitedListToSet(@Nullable String value) {
		if (value == null) {
			return new LinkedHashSet<>();
		}
		return Arrays.stream(value.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	/**
	 * Checks whether a media type header value such as
	 * {@code text/event-stream; charset=UTF-8} names the given base media type.
	 * @param contentType the header value, may be {@code null}
	 * @param mediaType the base media type to look for, e.g. {@code text/event-stream}
	 * @return {@code true} if the base type matches, ignoring parameters and case
	 */
	public static boolean isMediaType(@Nullable String contentType, String mediaType) {
		if (contentType == null) {
			return false;
		}
		int separator = contentType.indexOf(';');
		String base = (separator >= 0 ? contentType.substring(0, separator) : contentType).trim();
		return base.toLowerCase(Locale.ROOT).equals(mediaType.toLowerCase(Locale.ROOT));
	}

}
