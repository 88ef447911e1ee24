/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server;

import java.util.function.BiFunction;

import io.trellomcp.gateway.spec.McpSchema.CallToolRequest;
import io.trellomcp.gateway.spec.McpSchema.CallToolResult;
import io.trellomcp.gateway.spec.McpSchema.Tool;
import io.trellomcp.gateway.spec.McpTransportContext;
import io.trellomcp.gateway.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Features a gateway server can expose.
 */
public final class McpServerFeatures {

	private McpServerFeatures() {
	}

	/**
	 * Specification of a tool with its handler.
	 *
	 * <p>
	 * Example:<pre>{@code
	 * ToolSpecification.builder()
	 *     .tool(Tool.builder().name("create_card").inputSchema(schema).build())
	 *     .mutating(true)
	 *     .callHandler((context, request) -> cardService.create(request.arguments()))
	 *     .build();
	 * }</pre>
	 *
	 * @param tool the tool definition advertised through {@code tools/list}
	 * @param mutating whether the tool changes remote state; mutating tools are only
	 * executed for read-write callers
	 * @param callHandler the function invoked for {@code tools/call}. It receives the
	 * per-request transport context and the call request.
	 */
	public record ToolSpecification(Tool tool, boolean mutating,
			BiFunction<McpTransportContext, CallToolRequest, Mono<CallToolResult>> callHandler) {

		public ToolSpecification {
			Assert.notNull(tool, "Tool must not be null");
			Assert.notNull(callHandler, "Call handler function must not be null");
		}

		public static Builder builder() {
			return new Builder();
		}

		public static class Builder {

			private Tool tool;

			private boolean mutating;

			private BiFunction<McpTransportContext, CallToolRequest, Mono<CallToolResult>> callHandler;

			public Builder tool(Tool tool) {
				this.tool = tool;
				return this;
			}

			public Builder mutating(boolean mutating) {
				this.mutating = mutating;
				return this;
			}

			public Builder callHandler(
					BiFunction<McpTransportContext, CallToolRequest, Mono<CallToolResult>> callHandler) {
				this.callHandler = callHandler;
				return this;
			}

			public ToolSpecification build() {
				Assert.notNull(tool, "Tool must not be null");
				Assert.notNull(callHandler, "Call handler function must not be null");
				return new ToolSpecification(tool, mutating, callHandler);
			}

		}
	}

}
