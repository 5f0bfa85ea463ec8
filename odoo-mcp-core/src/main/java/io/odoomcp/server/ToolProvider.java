/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.util.List;

/**
 * Contributes tool specifications to the {@link ToolRegistry} at bootstrap. Each domain
 * module exposes one provider; providers are consulted once, in the order they are
 * registered, and never again after the registry is built.
 */
public interface ToolProvider {

	/**
	 * Returns the tools this provider contributes.
	 * @return the tool specifications, never {@code null}
	 */
	List<McpServerFeatures.AsyncToolSpecification> getToolSpecifications();

}
