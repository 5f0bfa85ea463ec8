/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.spec;

import io.odoomcp.spec.McpSchema.ErrorCodes;

/**
 * The top-level JSON-RPC method is not one the bridge serves.
 */
public class MethodNotFoundError extends McpError {

	private final String method;

	public MethodNotFoundError(String method) {
		super(ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + method);
		this.method = method;
	}

	public String getMethod() {
		return this.method;
	}

}
