/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.odoomcp.spec.McpSchema;
import io.odoomcp.spec.UnknownToolError;
import io.odoomcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable mapping from tool name to {@link McpServerFeatures.AsyncToolSpecification}.
 * <p>
 * A registry is assembled once through {@link #builder()} before the transport accepts
 * any request. Once built it is never mutated, so lookups from concurrent dispatches need
 * no synchronization. Listing order is registration order.
 * </p>
 */
public final class ToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	private final Map<String, McpServerFeatures.AsyncToolSpecification> tools;

	private final List<McpSchema.Tool> listing;

	private ToolRegistry(Map<String, McpServerFeatures.AsyncToolSpecification> tools) {
		this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
		this.listing = this.tools.values().stream().map(McpServerFeatures.AsyncToolSpecification::tool).toList();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ToolRegistry empty() {
		return new ToolRegistry(Map.of());
	}

	/**
	 * Resolve a tool by name.
	 * @param name the tool name
	 * @return the registered specification
	 * @throws UnknownToolError if no tool is registered under {@code name}
	 */
	public McpServerFeatures.AsyncToolSpecification lookup(String name) {
		McpServerFeatures.AsyncToolSpecification specification = (name != null) ? this.tools.get(name) : null;
		if (specification == null) {
			throw new UnknownToolError(name);
		}
		return specification;
	}

	public boolean contains(String name) {
		return this.tools.containsKey(name);
	}

	/**
	 * All registered tools in registration order. The returned list is unmodifiable and
	 * the same instance is returned on every call.
	 * @return the tool definitions
	 */
	public List<McpSchema.Tool> list() {
		return this.listing;
	}

	public int size() {
		return this.tools.size();
	}

	/**
	 * Collects tools before the registry is frozen.
	 */
	public static final class Builder {

		private final Map<String, McpServerFeatures.AsyncToolSpecification> tools = new LinkedHashMap<>();

		private Builder() {
		}

		/**
		 * Registers a tool.
		 * @param specification the tool to add
		 * @return this builder
		 * @throws DuplicateToolError if a tool with the same name was already registered
		 */
		public Builder register(McpServerFeatures.AsyncToolSpecification specification) {
			Assert.notNull(specification, "Tool specification must not be null");
			String name = specification.name();
			if (this.tools.containsKey(name)) {
				throw new DuplicateToolError(name);
			}
			this.tools.put(name, specification);
			logger.debug("Registered tool '{}'", name);
			return this;
		}

		public Builder registerAll(List<McpServerFeatures.AsyncToolSpecification> specifications) {
			Assert.notNull(specifications, "Tool specifications must not be null");
			for (McpServerFeatures.AsyncToolSpecification specification : specifications) {
				register(specification);
			}
			return this;
		}

		public Builder provider(ToolProvider provider) {
			Assert.notNull(provider, "Tool provider must not be null");
			return registerAll(new ArrayList<>(provider.getToolSpecifications()));
		}

		public ToolRegistry build() {
			ToolRegistry registry = new ToolRegistry(this.tools);
			logger.info("Tool registry built with {} tools", registry.size());
			return registry;
		}

	}

}
