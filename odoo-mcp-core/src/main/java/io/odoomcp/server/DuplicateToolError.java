/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

/**
 * Two tools were registered under the same name.
 */
public class DuplicateToolError extends IllegalStateException {

	private final String toolName;

	public DuplicateToolError(String toolName) {
		super("Tool with name '" + toolName + "' is already registered");
		this.toolName = toolName;
	}

	public String getToolName() {
		return this.toolName;
	}

}
