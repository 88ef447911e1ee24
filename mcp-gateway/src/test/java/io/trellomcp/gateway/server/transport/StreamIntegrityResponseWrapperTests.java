/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class StreamIntegrityResponseWrapperTests {

	@Test
	void permissivePolicyAppliesEveryHeaderExactlyOnce() {
		RecordingResponses.Recording recording = RecordingResponses.create();

		new StreamIntegrityResponseWrapper(recording.response, HeaderInjectionPolicy.PERMISSIVE);

		for (Map.Entry<String, String> header : StreamIntegrityResponseWrapper.STREAM_HEADERS.entrySet()) {
			assertThat(recording.headers(header.getKey())).containsExactly(header.getValue());
		}
	}

	@Test
	void applyingTwiceDoesNotDuplicateTokens() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.PERMISSIVE);

		wrapper.applyIfEligible();
		wrapper.setContentType("text/event-stream");
		wrapper.applyIfEligible();

		assertThat(recording.headers("Cache-Control")).containsExactly("no-cache, no-transform");
		assertThat(recording.headers("X-Accel-Buffering")).containsExactly("no");
		assertThat(recording.headers("X-Content-Type-Options")).containsExactly("nosniff");
	}

	@Test
	void mergesWithValuesSetByTheHandler() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.PERMISSIVE);

		wrapper.setHeader("Cache-Control", "no-store");
		wrapper.addHeader("cache-control", "No-Cache");

		assertThat(recording.headers("Cache-Control")).containsExactly("no-cache, no-transform, no-store");
	}

	@Test
	void keepsHeaderValuesSetBeforeWrapping() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		recording.response.setHeader("Cache-Control", "private");

		new StreamIntegrityResponseWrapper(recording.response, HeaderInjectionPolicy.PERMISSIVE);

		assertThat(recording.header("Cache-Control")).isEqualTo("private, no-cache, no-transform");
	}

	@Test
	void strictPolicySkipsNonStreamingResponses() throws Exception {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.STRICT);

		wrapper.setContentType("application/json");
		wrapper.getWriter();

		assertThat(recording.header("X-Accel-Buffering")).isNull();
		assertThat(recording.header("Cache-Control")).isNull();
	}

	@Test
	void strictPolicyAppliesOnceContentTypeIsStreaming() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.STRICT);

		wrapper.setHeader("Content-Type", "text/event-stream; charset=UTF-8");

		assertThat(recording.headers("X-Accel-Buffering")).containsExactly("no");
		assertThat(recording.headers("Connection")).containsExactly("keep-alive");
		assertThat(recording.headers("Content-Encoding")).containsExactly("identity");
	}

	@Test
	void strictPolicyMergesRatherThanReplaces() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.STRICT);

		wrapper.setHeader("Cache-Control", "no-store");
		wrapper.setContentType("text/event-stream");

		assertThat(recording.headers("Cache-Control")).containsExactly("no-store, no-cache, no-transform");
	}

	@Test
	void permissivePolicyAppliesToJsonResponses() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.PERMISSIVE);

		wrapper.setContentType("application/json");

		assertThat(recording.headers("X-Accel-Buffering")).containsExactly("no");
		assertThat(recording.headers("Cache-Control")).containsExactly("no-cache, no-transform");
	}

	@Test
	void committedResponsesAreLeftAlone() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		recording.committed.set(true);

		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.PERMISSIVE);

		assertThat(wrapper.applyIfEligible()).isFalse();
		assertThat(recording.headers).isEmpty();
	}

	@Test
	void resetReappliesHeaders() {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityResponseWrapper wrapper = new StreamIntegrityResponseWrapper(recording.response,
				HeaderInjectionPolicy.PERMISSIVE);

		wrapper.reset();

		assertThat(recording.headers("X-Accel-Buffering")).containsExactly("no");
	}

	@Test
	void nestedFiltersShareOneWrapper() throws Exception {
		RecordingResponses.Recording recording = RecordingResponses.create();
		StreamIntegrityFilter outer = new StreamIntegrityFilter(HeaderInjectionPolicy.PERMISSIVE);
		StreamIntegrityFilter inner = new StreamIntegrityFilter(HeaderInjectionPolicy.PERMISSIVE);
		AtomicReference<ServletResponse> seenByOuterChain = new AtomicReference<>();
		AtomicReference<ServletResponse> seenByHandler = new AtomicReference<>();
		HttpServletRequest request = mock(HttpServletRequest.class);

		FilterChain handler = (req, res) -> seenByHandler.set(res);
		FilterChain innerChain = (req, res) -> {
			seenByOuterChain.set(res);
			inner.doFilter(req, res, handler);
		};
		outer.doFilter(request, recording.response, innerChain);

		assertThat(seenByHandler.get()).isSameAs(seenByOuterChain.get())
			.isInstanceOf(StreamIntegrityResponseWrapper.class);
		assertThat(recording.headers("Cache-Control")).containsExactly("no-cache, no-transform");
	}

	@Test
	void mergeTokensIsCaseInsensitiveAndOrderPreserving() {
		assertThat(StreamIntegrityResponseWrapper.mergeTokens(null, "no-cache, no-transform"))
			.isEqualTo("no-cache, no-transform");
		assertThat(StreamIntegrityResponseWrapper.mergeTokens("No-Cache", "no-cache, no-transform"))
			.isEqualTo("No-Cache, no-transform");
		assertThat(StreamIntegrityResponseWrapper.mergeTokens("a, , b", "b,c")).isEqualTo("a, b, c");
	}

}
