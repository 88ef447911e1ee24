/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import io.trellomcp.gateway.spec.DefaultMcpTransportContext;
import io.trellomcp.gateway.spec.McpTransportContext;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoleContextTests {

	@Test
	void bindsRoleToTransportContextOnce() {
		McpTransportContext context = new DefaultMcpTransportContext();

		RoleContext.bind(context, Role.READ_ONLY);

		assertThat(RoleContext.current(context)).contains(Role.READ_ONLY);
		assertThatThrownBy(() -> RoleContext.bind(context, Role.READ_WRITE)).isInstanceOf(IllegalStateException.class);
		assertThat(RoleContext.current(context)).contains(Role.READ_ONLY);
	}

	@Test
	void contextsDoNotShareBindings() {
		McpTransportContext first = new DefaultMcpTransportContext();
		McpTransportContext second = new DefaultMcpTransportContext();

		RoleContext.bind(first, Role.READ_WRITE);

		assertThat(RoleContext.current(second)).isEmpty();
		assertThat(RoleContext.current((McpTransportContext) null)).isEmpty();
	}

	@Test
	void bindsRoleToRequestAttribute() {
		HttpServletRequest request = mock(HttpServletRequest.class);

		RoleContext.bind(request, Role.READ_WRITE);

		verify(request).setAttribute(RoleContext.REQUEST_ATTRIBUTE, Role.READ_WRITE);
	}

	@Test
	void rejectsSecondBindOnRequest() {
		HttpServletRequest request = mock(HttpServletRequest.class);
		when(request.getAttribute(RoleContext.REQUEST_ATTRIBUTE)).thenReturn(Role.READ_ONLY);

		assertThat(RoleContext.current(request)).contains(Role.READ_ONLY);
		assertThatThrownBy(() -> RoleContext.bind(request, Role.READ_WRITE))
			.isInstanceOf(IllegalStateException.class);
	}

}
