/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.odoomcp.server.transport.HeartbeatScheduler;
import io.odoomcp.server.transport.HttpServletSseServerTransport;
import io.odoomcp.spec.McpSchema;
import io.odoomcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Assembles a bridge server from its parts and owns their lifecycle.
 *
 * <pre>{@code
 * McpBridgeServer server = McpBridgeServer.builder()
 *     .serverInfo("odoo-mcp-bridge", "1.0.0")
 *     .toolProvider(new CrmToolProvider(odooClient))
 *     .keepAliveInterval(Duration.ofSeconds(30))
 *     .build();
 * tomcat.addServlet(ctx, "mcp", server.getTransport());
 * }</pre>
 */
public class McpBridgeServer {

	private static final Logger logger = LoggerFactory.getLogger(McpBridgeServer.class);

	public static final Duration DEFAULT_SESSION_IDLE_TIMEOUT = Duration.ofMinutes(30);

	private final McpDispatcher dispatcher;

	private final SessionManager sessionManager;

	private final HttpServletSseServerTransport transport;

	private final Disposable idleEviction;

	private McpBridgeServer(McpDispatcher dispatcher, SessionManager sessionManager,
			HttpServletSseServerTransport transport, Duration sessionIdleTimeout) {
		this.dispatcher = dispatcher;
		this.sessionManager = sessionManager;
		this.transport = transport;
		if (sessionIdleTimeout != null) {
			Duration period = sessionIdleTimeout.dividedBy(2);
			this.idleEviction = Flux.interval(period, period, Schedulers.parallel())
				.subscribe(tick -> sessionManager.evictIdle(sessionIdleTimeout),
						error -> logger.error("Idle session eviction stopped", error));
		}
		else {
			this.idleEviction = null;
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public McpDispatcher getDispatcher() {
		return this.dispatcher;
	}

	public SessionManager getSessionManager() {
		return this.sessionManager;
	}

	/**
	 * The servlet serving {@code /health}, {@code /sse} and {@code /messages}. Register it
	 * with async support enabled.
	 * @return the transport servlet
	 */
	public HttpServletSseServerTransport getTransport() {
		return this.transport;
	}

	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (this.idleEviction != null) {
				this.idleEviction.dispose();
			}
		}).then(this.transport.closeGracefully());
	}

	public void close() {
		closeGracefully().block();
	}

	/**
	 * Builder for {@link McpBridgeServer}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper;

		private McpSchema.Implementation serverInfo = new McpSchema.Implementation("odoo-mcp-bridge", "1.0.0");

		private String instructions;

		private final List<ToolProvider> toolProviders = new ArrayList<>();

		private final List<McpServerFeatures.AsyncToolSpecification> tools = new ArrayList<>();

		private Duration toolCallTimeout = McpDispatcher.DEFAULT_TOOL_CALL_TIMEOUT;

		private Duration keepAliveInterval = HeartbeatScheduler.DEFAULT_INTERVAL;

		private Duration sessionIdleTimeout = DEFAULT_SESSION_IDLE_TIMEOUT;

		private ResponseDelivery responseDelivery = ResponseDelivery.PULL;

		private boolean strictInitialization;

		private String sseEndpoint = HttpServletSseServerTransport.DEFAULT_SSE_ENDPOINT;

		private String messageEndpoint = HttpServletSseServerTransport.DEFAULT_MESSAGE_ENDPOINT;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder serverInfo(String name, String version) {
			Assert.hasText(name, "Server name must not be empty");
			Assert.hasText(version, "Server version must not be empty");
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder toolProvider(ToolProvider toolProvider) {
			Assert.notNull(toolProvider, "Tool provider must not be null");
			this.toolProviders.add(toolProvider);
			return this;
		}

		public Builder tool(McpServerFeatures.AsyncToolSpecification tool) {
			Assert.notNull(tool, "Tool specification must not be null");
			this.tools.add(tool);
			return this;
		}

		public Builder toolCallTimeout(Duration toolCallTimeout) {
			Assert.notNull(toolCallTimeout, "Tool call timeout must not be null");
			this.toolCallTimeout = toolCallTimeout;
			return this;
		}

		public Builder keepAliveInterval(Duration keepAliveInterval) {
			Assert.notNull(keepAliveInterval, "Keep-alive interval must not be null");
			this.keepAliveInterval = keepAliveInterval;
			return this;
		}

		/**
		 * Close sessions idle for longer than this. {@code null} disables eviction.
		 * @param sessionIdleTimeout the idle timeout
		 * @return this builder
		 */
		public Builder sessionIdleTimeout(Duration sessionIdleTimeout) {
			Assert.isTrue(sessionIdleTimeout == null || !sessionIdleTimeout.isNegative() && !sessionIdleTimeout.isZero(),
					"Session idle timeout must be positive");
			this.sessionIdleTimeout = sessionIdleTimeout;
			return this;
		}

		public Builder responseDelivery(ResponseDelivery responseDelivery) {
			Assert.notNull(responseDelivery, "Response delivery must not be null");
			this.responseDelivery = responseDelivery;
			return this;
		}

		public Builder strictInitialization(boolean strictInitialization) {
			this.strictInitialization = strictInitialization;
			return this;
		}

		public Builder sseEndpoint(String sseEndpoint) {
			this.sseEndpoint = sseEndpoint;
			return this;
		}

		public Builder messageEndpoint(String messageEndpoint) {
			this.messageEndpoint = messageEndpoint;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "Clock must not be null");
			this.clock = clock;
			return this;
		}

		public McpBridgeServer build() {
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();

			ToolRegistry.Builder registry = ToolRegistry.builder();
			this.toolProviders.forEach(registry::provider);
			registry.registerAll(this.tools);

			InitializationState initializationState = new InitializationState(this.serverInfo,
					McpSchema.ServerCapabilities.staticToolsAndResources(), this.instructions);

			McpDispatcher dispatcher = McpDispatcher.builder()
				.objectMapper(mapper)
				.toolRegistry(registry.build())
				.initializationState(initializationState)
				.toolCallTimeout(this.toolCallTimeout)
				.strictInitialization(this.strictInitialization)
				.build();

			SessionManager sessionManager = new SessionManager(this.clock);

			HttpServletSseServerTransport transport = HttpServletSseServerTransport.builder()
				.objectMapper(mapper)
				.dispatcher(dispatcher)
				.sessionManager(sessionManager)
				.serviceName(this.serverInfo.name())
				.sseEndpoint(this.sseEndpoint)
				.messageEndpoint(this.messageEndpoint)
				.keepAliveInterval(this.keepAliveInterval)
				.responseDelivery(this.responseDelivery)
				.clock(this.clock)
				.build();

			return new McpBridgeServer(dispatcher, sessionManager, transport, this.sessionIdleTimeout);
		}

	}

}
