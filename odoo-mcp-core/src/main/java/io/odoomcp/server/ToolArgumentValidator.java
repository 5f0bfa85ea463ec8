/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.util.List;
import java.util.Map;

import io.odoomcp.spec.InvalidParamsError;
import io.odoomcp.spec.McpSchema;

/**
 * Best-effort check of tool arguments against the tool's input schema. Only the presence
 * of required properties is verified; values are never coerced, so a type mismatch is
 * left for the handler (or the backend behind it) to reject.
 */
final class ToolArgumentValidator {

	private ToolArgumentValidator() {
	}

	static void validate(McpSchema.Tool tool, Map<String, Object> arguments) {
		McpSchema.JsonSchema schema = tool.inputSchema();
		if (schema == null) {
			return;
		}
		List<String> missing = schema.requiredOrEmpty()
			.stream()
			.filter(property -> arguments.get(property) == null)
			.toList();
		if (!missing.isEmpty()) {
			throw new InvalidParamsError(
					"Missing required argument" + (missing.size() > 1 ? "s" : "") + " for tool '" + tool.name()
							+ "': " + String.join(", ", missing));
		}
	}

}
