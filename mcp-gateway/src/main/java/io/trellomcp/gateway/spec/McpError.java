/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.spec;

import io.trellomcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;

/**
 * Protocol level failure that is reported to the client as a JSON-RPC error.
 */
public class McpError extends RuntimeException {

	private final JSONRPCError jsonRpcError;

	public McpError(JSONRPCError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public McpError(int code, String message) {
		this(new JSONRPCError(code, message, null));
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

	public static McpError invalidParams(String message) {
		return new McpError(McpSchema.ErrorCodes.INVALID_PARAMS, message);
	}

	public static McpError methodNotFound(String method) {
		return new McpError(McpSchema.ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + method);
	}

}
