/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.servlet.http.HttpServletResponse;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mockito backed {@link HttpServletResponse} that keeps its headers in a map.
 */
final class RecordingResponses {

	private RecordingResponses() {
	}

	static Recording create() {
		return new Recording();
	}

	static final class Recording {

		final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		final AtomicBoolean committed = new AtomicBoolean();

		final HttpServletResponse response = mock(HttpServletResponse.class);

		private Recording() {
			doAnswer(invocation -> {
				List<String> values = new ArrayList<>();
				values.add(invocation.getArgument(1));
				this.headers.put(invocation.getArgument(0), values);
				return null;
			}).when(this.response).setHeader(anyString(), anyString());
			doAnswer(invocation -> {
				this.headers.computeIfAbsent(invocation.getArgument(0), k -> new ArrayList<>())
					.add(invocation.getArgument(1));
				return null;
			}).when(this.response).addHeader(anyString(), anyString());
			doAnswer(invocation -> {
				List<String> values = new ArrayList<>();
				values.add(invocation.getArgument(0));
				this.headers.put("Content-Type", values);
				return null;
			}).when(this.response).setContentType(anyString());
			doAnswer(invocation -> {
				this.headers.clear();
				return null;
			}).when(this.response).reset();
			when(this.response.getContentType()).thenAnswer(invocation -> header("Content-Type"));
			when(this.response.getHeader(anyString())).thenAnswer(invocation -> header(invocation.getArgument(0)));
			when(this.response.getHeaders(anyString()))
				.thenAnswer(invocation -> new ArrayList<>(this.headers.getOrDefault(invocation.getArgument(0), List.of())));
			when(this.response.isCommitted()).thenAnswer(invocation -> this.committed.get());
		}

		String header(String name) {
			List<String> values = this.headers.get(name);
			return values == null || values.isEmpty() ? null : values.get(0);
		}

		List<String> headers(String name) {
			return this.headers.getOrDefault(name, List.of());
		}

	}

}
