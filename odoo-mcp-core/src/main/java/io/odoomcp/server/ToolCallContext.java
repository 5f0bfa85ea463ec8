/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import reactor.util.annotation.Nullable;

/**
 * Per-invocation context handed to a tool handler.
 *
 * @param toolName the name the tool was invoked under
 * @param requestId the JSON-RPC id of the {@code tools/call} request
 * @param sessionId the SSE session the request was correlated with, if any
 */
public record ToolCallContext(String toolName, Object requestId, @Nullable String sessionId) {

	public boolean hasSession() {
		return this.sessionId != null;
	}

}
