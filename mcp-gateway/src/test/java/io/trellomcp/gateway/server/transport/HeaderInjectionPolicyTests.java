/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeaderInjectionPolicyTests {

	@Test
	void parsesValuesIgnoringCase() {
		assertThat(HeaderInjectionPolicy.parse(null)).isEqualTo(HeaderInjectionPolicy.PERMISSIVE);
		assertThat(HeaderInjectionPolicy.parse(" ")).isEqualTo(HeaderInjectionPolicy.PERMISSIVE);
		assertThat(HeaderInjectionPolicy.parse("Strict ")).isEqualTo(HeaderInjectionPolicy.STRICT);
		assertThat(HeaderInjectionPolicy.parse("permissive")).isEqualTo(HeaderInjectionPolicy.PERMISSIVE);
	}

	@Test
	void rejectsUnknownValues() {
		assertThatThrownBy(() -> HeaderInjectionPolicy.parse("sometimes")).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("sometimes");
	}

	@Test
	void strictOnlyMatchesStreamingMediaTypes() {
		assertThat(HeaderInjectionPolicy.STRICT.appliesTo("text/event-stream")).isTrue();
		assertThat(HeaderInjectionPolicy.STRICT.appliesTo("text/event-stream;charset=UTF-8")).isTrue();
		assertThat(HeaderInjectionPolicy.STRICT.appliesTo("application/x-ndjson")).isTrue();
		assertThat(HeaderInjectionPolicy.STRICT.appliesTo("application/json")).isFalse();
		assertThat(HeaderInjectionPolicy.STRICT.appliesTo(null)).isFalse();
		assertThat(HeaderInjectionPolicy.PERMISSIVE.appliesTo(null)).isTrue();
	}

}
