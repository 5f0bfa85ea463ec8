/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.odoomcp.spec.InvalidParamsError;
import io.odoomcp.spec.MalformedRequestError;
import io.odoomcp.spec.McpError;
import io.odoomcp.spec.McpSchema;
import io.odoomcp.spec.McpSchema.JSONRPCResponse;
import io.odoomcp.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.odoomcp.spec.MethodNotFoundError;
import io.odoomcp.spec.ToolExecutionError;
import io.odoomcp.util.Assert;
import io.odoomcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * Decodes one JSON-RPC message, routes it to the MCP method it names and encodes the
 * outcome as a response envelope.
 * <p>
 * Every failure, including undecodable input, ends up as an error envelope: the returned
 * {@link Mono} never errors. Notifications complete empty because they have no response.
 * </p>
 */
public class McpDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(McpDispatcher.class);

	public static final Duration DEFAULT_TOOL_CALL_TIMEOUT = Duration.ofSeconds(30);

	private final ObjectMapper objectMapper;

	private final ToolRegistry toolRegistry;

	private final InitializationState initializationState;

	private final Duration toolCallTimeout;

	private final boolean strictInitialization;

	private final Scheduler toolScheduler;

	McpDispatcher(ObjectMapper objectMapper, ToolRegistry toolRegistry, InitializationState initializationState,
			Duration toolCallTimeout, boolean strictInitialization, Scheduler toolScheduler) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.notNull(toolRegistry, "Tool registry must not be null");
		Assert.notNull(initializationState, "Initialization state must not be null");
		Assert.notNull(toolCallTimeout, "Tool call timeout must not be null");
		Assert.notNull(toolScheduler, "Tool scheduler must not be null");
		this.objectMapper = objectMapper;
		this.toolRegistry = toolRegistry;
		this.initializationState = initializationState;
		this.toolCallTimeout = toolCallTimeout;
		this.strictInitialization = strictInitialization;
		this.toolScheduler = toolScheduler;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Mono<JSONRPCResponse> dispatch(String body) {
		return dispatch(body, null);
	}

	/**
	 * Handle one raw message.
	 * @param body the request body as received
	 * @param sessionId the SSE session the message was correlated with, if any
	 * @return the response, or an empty {@link Mono} for a notification
	 */
	public Mono<JSONRPCResponse> dispatch(String body, @Nullable String sessionId) {
		McpSchema.JSONRPCMessage message;
		try {
			message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, body);
		}
		catch (IOException e) {
			logger.debug("Rejecting unparseable message: {}", e.getMessage());
			return Mono.just(JSONRPCResponse.failure(null, MalformedRequestError.parseError(e).getJsonRpcError()));
		}
		catch (IllegalArgumentException e) {
			Object id = McpSchema.extractRequestId(this.objectMapper, body);
			logger.debug("Rejecting invalid request: {}", e.getMessage());
			return Mono
				.just(JSONRPCResponse.failure(id, MalformedRequestError.invalidRequest(e.getMessage()).getJsonRpcError()));
		}

		if (message instanceof McpSchema.JSONRPCNotification notification) {
			handleNotification(notification);
			return Mono.empty();
		}
		McpSchema.JSONRPCRequest request = (McpSchema.JSONRPCRequest) message;
		return Mono.defer(() -> route(request, sessionId))
			.map(result -> JSONRPCResponse.success(request.id(), result))
			.onErrorResume(t -> Mono.just(JSONRPCResponse.failure(request.id(), toJsonRpcError(request, t))));
	}

	private void handleNotification(McpSchema.JSONRPCNotification notification) {
		if (McpSchema.METHOD_NOTIFICATION_INITIALIZED.equals(notification.method())) {
			logger.debug("Client acknowledged initialization");
		}
		else {
			logger.debug("Ignoring notification {}", notification.method());
		}
	}

	private Mono<Object> route(McpSchema.JSONRPCRequest request, @Nullable String sessionId) {
		switch (request.method()) {
			case McpSchema.METHOD_INITIALIZE: {
				McpSchema.InitializeRequest initializeRequest = convertParams(request.params(),
						McpSchema.InitializeRequest.class);
				return Mono.just(this.initializationState.initialize(initializeRequest));
			}
			case McpSchema.METHOD_PING:
				return Mono.just(Map.of());
			case McpSchema.METHOD_TOOLS_LIST:
				return Mono.just(new McpSchema.ListToolsResult(this.toolRegistry.list()));
			case McpSchema.METHOD_TOOLS_CALL:
				return callTool(request, sessionId);
			default:
				return Mono.error(new MethodNotFoundError(request.method()));
		}
	}

	private Mono<Object> callTool(McpSchema.JSONRPCRequest request, @Nullable String sessionId) {
		if (!(request.params() == null || request.params() instanceof Map)) {
			return Mono.error(new InvalidParamsError("Parameters of tools/call must be an object"));
		}
		McpSchema.CallToolRequest callToolRequest = convertParams(request.params(), McpSchema.CallToolRequest.class);
		if (callToolRequest == null || !Utils.hasText(callToolRequest.name())) {
			return Mono.error(new InvalidParamsError("Missing required parameter: name"));
		}
		String toolName = callToolRequest.name();

		if (!this.initializationState.isInitialized()) {
			if (this.strictInitialization) {
				return Mono.error(MalformedRequestError
					.invalidRequest("tools/call received before initialize (tool '" + toolName + "')"));
			}
			logger.warn("Tool '{}' called before initialize", toolName);
		}

		McpServerFeatures.AsyncToolSpecification specification = this.toolRegistry.lookup(toolName);
		Map<String, Object> arguments = callToolRequest.argumentsOrEmpty();
		ToolArgumentValidator.validate(specification.tool(), arguments);

		Duration timeout = (specification.timeout() != null) ? specification.timeout() : this.toolCallTimeout;
		ToolCallContext context = new ToolCallContext(toolName, request.id(), sessionId);
		long start = System.nanoTime();

		return Mono.defer(() -> specification.callHandler().handle(context, arguments))
			.subscribeOn(this.toolScheduler)
			.timeout(timeout, Mono.error(() -> ToolExecutionError.timedOut(toolName, timeout)))
			.defaultIfEmpty(Map.of())
			.onErrorMap(t -> !(t instanceof McpError), t -> ToolExecutionError.failed(toolName, t))
			.doOnSuccess(result -> logger.info("Tool '{}' completed in {} ms", toolName, elapsedMillis(start)))
			.doOnError(t -> logger.warn("Tool '{}' failed after {} ms: {}", toolName, elapsedMillis(start),
					t.getMessage()));
	}

	private <T> T convertParams(Object params, Class<T> type) {
		if (params == null) {
			return null;
		}
		try {
			return this.objectMapper.convertValue(params, type);
		}
		catch (IllegalArgumentException e) {
			throw new InvalidParamsError("Invalid parameters: " + e.getMessage());
		}
	}

	private JSONRPCError toJsonRpcError(McpSchema.JSONRPCRequest request, Throwable t) {
		if (t instanceof McpError mcpError && mcpError.getJsonRpcError() != null) {
			return mcpError.getJsonRpcError();
		}
		logger.error("Unexpected failure handling {}", request.method(), t);
		return new JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, t.getMessage(), null);
	}

	private static long elapsedMillis(long start) {
		return Duration.ofNanos(System.nanoTime() - start).toMillis();
	}

	public ToolRegistry getToolRegistry() {
		return this.toolRegistry;
	}

	public InitializationState getInitializationState() {
		return this.initializationState;
	}

	/**
	 * Builder for {@link McpDispatcher}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper;

		private ToolRegistry toolRegistry;

		private InitializationState initializationState;

		private Duration toolCallTimeout = DEFAULT_TOOL_CALL_TIMEOUT;

		private boolean strictInitialization;

		private Scheduler toolScheduler = Schedulers.boundedElastic();

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder toolRegistry(ToolRegistry toolRegistry) {
			this.toolRegistry = toolRegistry;
			return this;
		}

		public Builder initializationState(InitializationState initializationState) {
			this.initializationState = initializationState;
			return this;
		}

		public Builder toolCallTimeout(Duration toolCallTimeout) {
			Assert.notNull(toolCallTimeout, "Tool call timeout must not be null");
			Assert.isTrue(!toolCallTimeout.isNegative() && !toolCallTimeout.isZero(),
					"Tool call timeout must be positive");
			this.toolCallTimeout = toolCallTimeout;
			return this;
		}

		/**
		 * Reject {@code tools/call} with {@code -32600} until {@code initialize} has been
		 * received. Off by default: such calls are served and logged at WARN.
		 * @param strictInitialization whether to reject early tool calls
		 * @return this builder
		 */
		public Builder strictInitialization(boolean strictInitialization) {
			this.strictInitialization = strictInitialization;
			return this;
		}

		public Builder toolScheduler(Scheduler toolScheduler) {
			this.toolScheduler = toolScheduler;
			return this;
		}

		public McpDispatcher build() {
			return new McpDispatcher(this.objectMapper != null ? this.objectMapper : new ObjectMapper(),
					this.toolRegistry != null ? this.toolRegistry : ToolRegistry.empty(),
					this.initializationState != null ? this.initializationState
							: new InitializationState(new McpSchema.Implementation("odoo-mcp-bridge", "1.0.0"),
									McpSchema.ServerCapabilities.staticToolsAndResources(), null),
					this.toolCallTimeout, this.strictInitialization, this.toolScheduler);
		}

	}

}
