/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.trellomcp.gateway.util.Utils;

/**
 * Typed access to the loosely typed {@code arguments} of a {@code tools/call} request.
 * <p>
 * Missing required arguments and values of the wrong type raise an
 * {@link IllegalArgumentException}, which the dispatcher reports back to the caller as
 * an error result.
 */
public final class ToolArguments {

	private final Map<String, Object> arguments;

	public ToolArguments(Map<String, Object> arguments) {
		this.arguments = arguments != null ? arguments : Map.of();
	}

	public String requireString(String name) {
		String value = optionalString(name);
		if (!Utils.hasText(value)) {
			throw new IllegalArgumentException("Missing required argument: " + name);
		}
		return value;
	}

	public String optionalString(String name) {
		Object value = this.arguments.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof String || value instanceof Number || value instanceof Boolean) {
			return String.valueOf(value);
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be a string");
	}

	public Boolean optionalBoolean(String name) {
		Object value = this.arguments.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof Boolean bool) {
			return bool;
		}
		if (value instanceof String text) {
			String normalized = text.trim().toLowerCase(Locale.ROOT);
			if (normalized.equals("true") || normalized.equals("false")) {
				return Boolean.valueOf(normalized);
			}
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be a boolean");
	}

	public Integer optionalInteger(String name) {
		Object value = this.arguments.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		if (value instanceof String text) {
			try {
				return Integer.parseInt(text.trim());
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Argument '" + name + "' must be an integer", e);
			}
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be an integer");
	}

	/**
	 * A list of strings, given either as a JSON array or as a comma separated string.
	 */
	public List<String> optionalStringList(String name) {
		Object value = this.arguments.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof List<?> list) {
			List<String> result = new ArrayList<>(list.size());
			for (Object item : list) {
				result.add(String.valueOf(item));
			}
			return result;
		}
		if (value instanceof String text) {
			return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be an array of strings");
	}

	@SuppressWarnings("unchecked")
	public Map<String, Object> requireObject(String name) {
		Object value = this.arguments.get(name);
		if (value == null) {
			throw new IllegalArgumentException("Missing required argument: " + name);
		}
		if (value instanceof Map<?, ?> map) {
			return (Map<String, Object>) map;
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be an object");
	}

}
