/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.util.concurrent.atomic.AtomicReference;

import io.odoomcp.spec.McpSchema;
import io.odoomcp.spec.ProtocolVersions;
import io.odoomcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide record of the first successful {@code initialize}. It is written exactly
 * once; later {@code initialize} calls receive the result negotiated the first time.
 */
public class InitializationState {

	private static final Logger logger = LoggerFactory.getLogger(InitializationState.class);

	private final McpSchema.Implementation serverInfo;

	private final McpSchema.ServerCapabilities capabilities;

	private final String instructions;

	private final AtomicReference<McpSchema.InitializeResult> result = new AtomicReference<>();

	public InitializationState(McpSchema.Implementation serverInfo, McpSchema.ServerCapabilities capabilities,
			String instructions) {
		Assert.notNull(serverInfo, "Server info must not be null");
		Assert.notNull(capabilities, "Server capabilities must not be null");
		this.serverInfo = serverInfo;
		this.capabilities = capabilities;
		this.instructions = instructions;
	}

	/**
	 * Records the initialization if it has not happened yet and returns the (possibly
	 * earlier) result.
	 * @param request the client's initialize request, may be {@code null}
	 * @return the initialize result shared by every caller
	 */
	public McpSchema.InitializeResult initialize(McpSchema.InitializeRequest request) {
		String requested = (request != null) ? request.protocolVersion() : null;
		McpSchema.InitializeResult candidate = new McpSchema.InitializeResult(negotiate(requested), this.capabilities,
				this.serverInfo, this.instructions);
		if (this.result.compareAndSet(null, candidate)) {
			logger.info("Initialized with protocol version {} for client {}", candidate.protocolVersion(),
					(request != null && request.clientInfo() != null) ? request.clientInfo().name() : "<unknown>");
			return candidate;
		}
		McpSchema.InitializeResult existing = this.result.get();
		logger.debug("Repeated initialize; returning protocol version {}", existing.protocolVersion());
		return existing;
	}

	public boolean isInitialized() {
		return this.result.get() != null;
	}

	public String protocolVersion() {
		McpSchema.InitializeResult current = this.result.get();
		return (current != null) ? current.protocolVersion() : null;
	}

	public McpSchema.ServerCapabilities capabilities() {
		return this.capabilities;
	}

	public McpSchema.Implementation serverInfo() {
		return this.serverInfo;
	}

	static String negotiate(String requested) {
		if (requested != null && ProtocolVersions.SUPPORTED.contains(requested)) {
			return requested;
		}
		return ProtocolVersions.MCP_2024_11_05;
	}

}
