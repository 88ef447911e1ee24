/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.gateway.server.auth.PermissionDeniedException;
import io.trellomcp.gateway.server.auth.Role;
import io.trellomcp.gateway.server.auth.RoleContext;
import io.trellomcp.gateway.server.auth.WriteGuard;
import io.trellomcp.gateway.spec.McpError;
import io.trellomcp.gateway.spec.McpSchema;
import io.trellomcp.gateway.spec.McpSchema.CallToolRequest;
import io.trellomcp.gateway.spec.McpSchema.CallToolResult;
import io.trellomcp.gateway.spec.McpSchema.Implementation;
import io.trellomcp.gateway.spec.McpSchema.InitializeRequest;
import io.trellomcp.gateway.spec.McpSchema.InitializeResult;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCNotification;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCRequest;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCResponse;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.trellomcp.gateway.spec.McpSchema.ListToolsResult;
import io.trellomcp.gateway.spec.McpSchema.ServerCapabilities;
import io.trellomcp.gateway.spec.McpSchema.Tool;
import io.trellomcp.gateway.spec.McpTransportContext;
import io.trellomcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Routes JSON-RPC requests to the registered tools.
 * <p>
 * The dispatcher is transport agnostic: every call receives the
 * {@link McpTransportContext} of the request it belongs to, and that context is handed
 * unchanged to the tool handler. Tools flagged as mutating are wrapped with
 * {@link WriteGuard#guard} when they are registered.
 * <p>
 * Failures raised by a tool are reported as a {@link CallToolResult} with
 * {@code isError=true}. Protocol failures (unknown method, unknown tool, malformed
 * parameters) are reported as JSON-RPC errors.
 */
public class McpToolDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(McpToolDispatcher.class);

	private final Implementation serverInfo;

	private final String instructions;

	private final ObjectMapper objectMapper;

	private final Map<String, ToolSpecification> tools;

	private final Scheduler toolScheduler;

	private McpToolDispatcher(Builder builder) {
		this.serverInfo = builder.serverInfo;
		this.instructions = builder.instructions;
		this.objectMapper = builder.objectMapper;
		this.toolScheduler = builder.toolScheduler;
		Map<String, ToolSpecification> registered = new LinkedHashMap<>();
		for (ToolSpecification spec : builder.tools) {
			String name = spec.tool().name();
			Assert.isTrue(!registered.containsKey(name), "Tool with name '" + name + "' is already registered");
			registered.put(name, spec.mutating()
					? new ToolSpecification(spec.tool(), true, WriteGuard.guard(name, spec.callHandler())) : spec);
		}
		this.tools = Collections.unmodifiableMap(registered);
		logger.info("Registered {} tools ({} mutating)", this.tools.size(),
				this.tools.values().stream().filter(ToolSpecification::mutating).count());
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<Tool> listTools() {
		return this.tools.values().stream().map(ToolSpecification::tool).toList();
	}

	/**
	 * Whether a registered tool is flagged as mutating.
	 * @param name the tool name
	 * @return {@code true} if the tool exists and is mutating
	 */
	public boolean isMutating(String name) {
		ToolSpecification spec = this.tools.get(name);
		return spec != null && spec.mutating();
	}

	/**
	 * Handles a request and produces exactly one response.
	 * @param context the transport context of the calling request
	 * @param request the request
	 * @return the success or error response, never an error signal
	 */
	public Mono<JSONRPCResponse> handleRequest(McpTransportContext context, JSONRPCRequest request) {
		return Mono.defer(() -> route(context, request))
			.map(result -> JSONRPCResponse.success(request.id(), result))
			.onErrorResume(McpError.class, e -> {
				logger.debug("Request {} '{}' failed: {}", request.id(), request.method(), e.getMessage());
				return Mono.just(JSONRPCResponse.failure(request.id(), e.getJsonRpcError()));
			})
			.onErrorResume(e -> !(e instanceof McpError), e -> {
				logger.error("Unexpected failure handling '{}'", request.method(), e);
				return Mono.just(JSONRPCResponse.failure(request.id(),
						new JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, e.getMessage(), null)));
			});
	}

	/**
	 * Handles a notification. Notifications never produce a response.
	 * @param context the transport context of the calling request
	 * @param notification the notification
	 * @return completion signal
	 */
	public Mono<Void> handleNotification(McpTransportContext context, JSONRPCNotification notification) {
		if (McpSchema.METHOD_NOTIFICATION_INITIALIZED.equals(notification.method())) {
			logger.debug("Client initialized");
		}
		else {
			logger.debug("Ignoring notification '{}'", notification.method());
		}
		return Mono.empty();
	}

	private Mono<Object> route(McpTransportContext context, JSONRPCRequest request) {
		String method = request.method();
		if (McpSchema.METHOD_INITIALIZE.equals(method)) {
			return Mono.just(initialize(request.params()));
		}
		if (McpSchema.METHOD_PING.equals(method)) {
			return Mono.just(Map.of());
		}
		if (McpSchema.METHOD_TOOLS_LIST.equals(method)) {
			return Mono.just(new ListToolsResult(listTools(), null));
		}
		if (McpSchema.METHOD_TOOLS_CALL.equals(method)) {
			return callTool(context, request.params()).cast(Object.class);
		}
		return Mono.error(McpError.methodNotFound(method));
	}

	private InitializeResult initialize(Object params) {
		InitializeRequest initializeRequest = convert(params, InitializeRequest.class);
		String requested = initializeRequest != null ? initializeRequest.protocolVersion() : null;
		String negotiated = McpSchema.SUPPORTED_PROTOCOL_VERSIONS.contains(requested) ? requested
				: McpSchema.LATEST_PROTOCOL_VERSION;
		if (initializeRequest != null && initializeRequest.clientInfo() != null) {
			logger.info("Client initialize request - Protocol: {}, Info: {}", requested,
					initializeRequest.clientInfo());
		}
		if (!negotiated.equals(requested)) {
			logger.warn("Client requested unsupported protocol version: {}, responding with {}", requested,
					negotiated);
		}
		return new InitializeResult(negotiated,
				new ServerCapabilities(new ServerCapabilities.ToolCapabilities(false)), this.serverInfo,
				this.instructions);
	}

	private Mono<CallToolResult> callTool(McpTransportContext context, Object params) {
		CallToolRequest callToolRequest = convert(params, CallToolRequest.class);
		if (callToolRequest == null || callToolRequest.name() == null) {
			return Mono.error(McpError.invalidParams("Tool name must be provided"));
		}
		ToolSpecification spec = this.tools.get(callToolRequest.name());
		if (spec == null) {
			return Mono.error(McpError.invalidParams("Unknown tool: invalid_tool_name: " + callToolRequest.name()));
		}
		String role = RoleContext.current(context).map(Role::value).orElse("none");
		logger.debug("Calling tool '{}' as {}", callToolRequest.name(), role);
		return Mono.defer(() -> spec.callHandler().apply(context, callToolRequest))
			.subscribeOn(this.toolScheduler)
			.onErrorResume(e -> {
				if (e instanceof PermissionDeniedException) {
					logger.warn("Tool '{}' rejected for role {}: {}", callToolRequest.name(), role, e.getMessage());
				}
				else if (e instanceof McpError || e instanceof IllegalArgumentException) {
					logger.warn("Tool '{}' called with invalid arguments by role {}: {}", callToolRequest.name(), role,
							e.getMessage());
				}
				else {
					logger.error("Tool '{}' failed for role {}: {}", callToolRequest.name(), role, e.getMessage(),
							e);
				}
				return Mono.just(CallToolResult.error(messageOf(e)));
			});
	}

	private <T> T convert(Object params, Class<T> type) {
		if (params == null) {
			return null;
		}
		try {
			return this.objectMapper.convertValue(params, type);
		}
		catch (IllegalArgumentException e) {
			throw McpError.invalidParams("Invalid params: " + e.getMessage());
		}
	}

	private static String messageOf(Throwable e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}

	public static class Builder {

		private Implementation serverInfo = new Implementation("mcp-gateway", "1.0.0");

		private String instructions;

		private ObjectMapper objectMapper = new ObjectMapper();

		private Scheduler toolScheduler = Schedulers.boundedElastic();

		private final List<ToolSpecification> tools = new ArrayList<>();

		public Builder serverInfo(String name, String version) {
			Assert.hasText(name, "Name must not be empty");
			Assert.hasText(version, "Version must not be empty");
			this.serverInfo = new Implementation(name, version);
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder toolScheduler(Scheduler toolScheduler) {
			Assert.notNull(toolScheduler, "Scheduler must not be null");
			this.toolScheduler = toolScheduler;
			return this;
		}

		public Builder tool(ToolSpecification tool) {
			Assert.notNull(tool, "Tool specification must not be null");
			this.tools.add(tool);
			return this;
		}

		public Builder tools(List<ToolSpecification> tools) {
			Assert.notNull(tools, "Tool list must not be null");
			tools.forEach(this::tool);
			return this;
		}

		public McpToolDispatcher build() {
			return new McpToolDispatcher(this);
		}

	}

}
