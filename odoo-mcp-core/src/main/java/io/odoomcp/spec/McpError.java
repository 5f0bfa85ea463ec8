/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.spec;

import io.odoomcp.spec.McpSchema.JSONRPCResponse.JSONRPCError;

/**
 * Base of every failure that can be reported to a client as a JSON-RPC error object.
 * The carried {@link JSONRPCError} is written to the wire as is.
 */
public class McpError extends RuntimeException {

	private final JSONRPCError jsonRpcError;

	public McpError(JSONRPCError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public McpError(JSONRPCError jsonRpcError, Throwable cause) {
		super(jsonRpcError.message(), cause);
		this.jsonRpcError = jsonRpcError;
	}

	public McpError(int code, String message) {
		this(new JSONRPCError(code, message, null));
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

	public int getCode() {
		return this.jsonRpcError.code();
	}

}
