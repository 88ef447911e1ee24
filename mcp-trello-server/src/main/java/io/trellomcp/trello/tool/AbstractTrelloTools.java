/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.gateway.spec.McpSchema.CallToolResult;
import io.trellomcp.gateway.spec.McpSchema.Tool;
import io.trellomcp.gateway.spec.McpSchema.ToolAnnotations;
import io.trellomcp.gateway.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Base class of the Trello tool groups.
 * <p>
 * Each group turns service calls into {@link ToolSpecification}s whose results are the
 * JSON rendering of the returned value as a single text content.
 */
public abstract class AbstractTrelloTools {

	protected final ObjectMapper objectMapper;

	protected AbstractTrelloTools(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	/**
	 * @return the tools of this group
	 */
	public abstract List<ToolSpecification> specifications();

	protected ToolSpecification readTool(String name, String description, String inputSchema,
			Function<ToolArguments, Mono<?>> handler) {
		return tool(name, description, inputSchema, false, handler);
	}

	protected ToolSpecification writeTool(String name, String description, String inputSchema,
			Function<ToolArguments, Mono<?>> handler) {
		return tool(name, description, inputSchema, true, handler);
	}

	private ToolSpecification tool(String name, String description, String inputSchema, boolean mutating,
			Function<ToolArguments, Mono<?>> handler) {
		Tool tool = Tool.builder()
			.name(name)
			.description(description)
			.inputSchema(this.objectMapper, inputSchema)
			.annotations(new ToolAnnotations(null, !mutating, null, null, true))
			.build();
		return ToolSpecification.builder()
			.tool(tool)
			.mutating(mutating)
			.callHandler((transportContext, request) -> Mono
				.defer(() -> handler.apply(new ToolArguments(request.arguments())))
				.map(this::toResult)
				.defaultIfEmpty(new CallToolResult("{}", false)))
			.build();
	}

	CallToolResult toResult(Object value) {
		if (value instanceof String text) {
			return new CallToolResult(text, false);
		}
		try {
			return new CallToolResult(this.objectMapper.writeValueAsString(value), false);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize tool result", e);
		}
	}

}
