/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.odoomcp.server.HealthStatus;
import io.odoomcp.server.McpDispatcher;
import io.odoomcp.server.McpSession;
import io.odoomcp.server.ResponseDelivery;
import io.odoomcp.server.SessionManager;
import io.odoomcp.server.SseEvent;
import io.odoomcp.spec.McpSchema;
import io.odoomcp.spec.McpSchema.JSONRPCResponse;
import io.odoomcp.util.Assert;
import io.odoomcp.util.Utils;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Servlet implementation of the MCP HTTP with SSE transport.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>{@code GET /health} reports liveness, the number of tools and whether the server
 * has been initialized.</li>
 * <li>{@code GET /sse} opens an event stream. The stream announces the message endpoint,
 * the session token and readiness, then emits a heartbeat at a fixed interval until the
 * client goes away.</li>
 * <li>{@code POST /messages} (with or without trailing slash) carries one JSON-RPC
 * message. By default the response is the body of the POST; with
 * {@link ResponseDelivery#PUSH} it is written to the caller's SSE stream instead.</li>
 * </ul>
 * Every response carries permissive CORS headers and the caching headers needed to get
 * unbuffered delivery through reverse proxies.
 * </p>
 */
@WebServlet(asyncSupported = true)
public class HttpServletSseServerTransport extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(HttpServletSseServerTransport.class);

	public static final String UTF_8 = "UTF-8";

	public static final String APPLICATION_JSON = "application/json";

	public static final String TEXT_EVENT_STREAM = "text/event-stream";

	public static final String DEFAULT_SSE_ENDPOINT = "/sse";

	public static final String DEFAULT_MESSAGE_ENDPOINT = "/messages";

	public static final String DEFAULT_HEALTH_ENDPOINT = "/health";

	public static final String SESSION_ID_PARAM = "session_id";

	public static final String SESSION_ID_PARAM_ALIAS = "sessionId";

	public static final String READY_MESSAGE = "MCP server ready";

	private static final String CACHE_CONTROL_NO_STORE = "no-cache, no-store, must-revalidate";

	private final ObjectMapper objectMapper;

	private final McpDispatcher dispatcher;

	private final SessionManager sessionManager;

	private final HeartbeatScheduler heartbeatScheduler;

	private final Scheduler transportScheduler;

	private final String serviceName;

	private final String sseEndpoint;

	private final String messageEndpoint;

	private final String healthEndpoint;

	private final ResponseDelivery responseDelivery;

	private final Clock clock;

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private HttpServletSseServerTransport(Builder builder) {
		this.objectMapper = builder.objectMapper;
		this.dispatcher = builder.dispatcher;
		this.sessionManager = builder.sessionManager;
		this.serviceName = builder.serviceName;
		this.sseEndpoint = builder.sseEndpoint;
		this.messageEndpoint = builder.messageEndpoint;
		this.healthEndpoint = builder.healthEndpoint;
		this.responseDelivery = builder.responseDelivery;
		this.clock = builder.clock;
		this.transportScheduler = Schedulers.newBoundedElastic(4, Integer.MAX_VALUE, "mcp-sse-transport", 60, true);
		this.heartbeatScheduler = new HeartbeatScheduler(builder.keepAliveInterval, this.transportScheduler,
				this.clock);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String path = resolvePath(request);
		if (this.healthEndpoint.equals(path)) {
			handleHealth(response);
		}
		else if (this.sseEndpoint.equals(path)) {
			handleSse(request, response);
		}
		else if (this.messageEndpoint.equals(path)) {
			sendStatus(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "Method not allowed");
		}
		else {
			sendStatus(response, HttpServletResponse.SC_NOT_FOUND, "Not found");
		}
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String path = resolvePath(request);
		if (this.messageEndpoint.equals(path)) {
			handleMessage(request, response);
		}
		else if (this.sseEndpoint.equals(path) || this.healthEndpoint.equals(path)) {
			sendStatus(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "Method not allowed");
		}
		else {
			sendStatus(response, HttpServletResponse.SC_NOT_FOUND, "Not found");
		}
	}

	@Override
	protected void doOptions(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		addCorsHeaders(response);
		response.setHeader("Access-Control-Max-Age", "86400");
		response.setStatus(HttpServletResponse.SC_NO_CONTENT);
	}

	@Override
	protected void doPut(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		sendStatus(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "Method not allowed");
	}

	@Override
	protected void doDelete(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		sendStatus(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "Method not allowed");
	}

	private void handleHealth(HttpServletResponse response) throws IOException {
		HealthStatus status = new HealthStatus(HealthStatus.HEALTHY, this.serviceName,
				this.dispatcher.getToolRegistry().size(), this.dispatcher.getInitializationState().isInitialized(),
				this.sessionManager.activeCount(), this.clock.instant().toString());
		writeJson(response, HttpServletResponse.SC_OK, this.objectMapper.writeValueAsString(status));
	}

	private void handleSse(HttpServletRequest request, HttpServletResponse response) throws IOException {
		if (this.isClosing.get()) {
			sendStatus(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
			return;
		}

		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(TEXT_EVENT_STREAM);
		response.setCharacterEncoding(UTF_8);
		response.setHeader("Cache-Control", CACHE_CONTROL_NO_STORE);
		response.setHeader("Connection", "keep-alive");
		response.setHeader("X-Accel-Buffering", "no");
		addCorsHeaders(response);

		AsyncContext asyncContext = request.startAsync();
		asyncContext.setTimeout(0);
		PrintWriter writer = response.getWriter();

		McpSession session = this.sessionManager.openSession();
		String sessionId = session.getId();
		asyncContext.addListener(new SessionAsyncListener(sessionId));

		session.events().subscribe(event -> {
			try {
				writeEvent(writer, event);
				this.sessionManager.touch(sessionId);
			}
			catch (IOException e) {
				logger.info("SSE write failed for session {}, closing: {}", sessionId, e.getMessage());
				this.sessionManager.close(sessionId);
			}
		}, error -> {
			logger.warn("SSE stream for session {} failed: {}", sessionId, error.getMessage());
			completeQuietly(asyncContext, sessionId);
		}, () -> completeQuietly(asyncContext, sessionId));

		String endpoint = (this.responseDelivery == ResponseDelivery.PUSH)
				? this.messageEndpoint + "?" + SESSION_ID_PARAM + "=" + sessionId : this.messageEndpoint;
		session.send(new SseEvent(SseEvent.ENDPOINT, endpoint));
		session.send(new SseEvent(SseEvent.SESSION, sessionId));
		session.send(new SseEvent(SseEvent.READY, READY_MESSAGE));

		if (session.isOpen()) {
			this.heartbeatScheduler.start(session);
		}
	}

	private void handleMessage(HttpServletRequest request, HttpServletResponse response) throws IOException {
		if (this.isClosing.get()) {
			sendStatus(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
			return;
		}

		String sessionId = sessionIdOf(request);
		if (sessionId != null) {
			this.sessionManager.touch(sessionId);
		}

		String body = readBody(request);

		Optional<McpSession> pushTarget = (this.responseDelivery == ResponseDelivery.PUSH)
				? this.sessionManager.find(sessionId) : Optional.empty();
		if (pushTarget.isPresent()) {
			McpSession session = pushTarget.get();
			this.dispatcher.dispatch(body, sessionId)
				.map(this::encode)
				.subscribe(json -> session.send(new SseEvent(SseEvent.MESSAGE, json)),
						error -> logger.error("Failed to deliver response to session {}", sessionId, error));
			sendAccepted(response);
			return;
		}

		JSONRPCResponse rpcResponse = this.dispatcher.dispatch(body, sessionId).block();
		if (rpcResponse == null) {
			sendAccepted(response);
			return;
		}
		int status = (rpcResponse.error() == null) ? HttpServletResponse.SC_OK : HttpServletResponse.SC_BAD_REQUEST;
		writeJson(response, status, encode(rpcResponse));
	}

	private String encode(JSONRPCResponse rpcResponse) {
		try {
			return this.objectMapper.writeValueAsString(rpcResponse);
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to serialize response to request {}", rpcResponse.id(), e);
			JSONRPCResponse failure = JSONRPCResponse.failure(rpcResponse.id(),
					new JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR,
							"Failed to serialize result: " + e.getOriginalMessage(), null));
			try {
				return this.objectMapper.writeValueAsString(failure);
			}
			catch (JsonProcessingException unexpected) {
				throw new IllegalStateException(unexpected);
			}
		}
	}

	private String sessionIdOf(HttpServletRequest request) {
		String sessionId = request.getParameter(SESSION_ID_PARAM);
		if (!Utils.hasText(sessionId)) {
			sessionId = request.getParameter(SESSION_ID_PARAM_ALIAS);
		}
		return Utils.hasText(sessionId) ? sessionId : null;
	}

	private String readBody(HttpServletRequest request) throws IOException {
		// JSON is UTF-8 unless the client says otherwise; the servlet default is ISO-8859-1
		if (request.getCharacterEncoding() == null) {
			request.setCharacterEncoding(UTF_8);
		}
		StringBuilder body = new StringBuilder();
		try (BufferedReader reader = request.getReader()) {
			String line;
			while ((line = reader.readLine()) != null) {
				body.append(line).append('\n');
			}
		}
		return body.toString();
	}

	private String resolvePath(HttpServletRequest request) {
		String uri = request.getRequestURI();
		String contextPath = request.getContextPath();
		if (uri != null && Utils.hasText(contextPath) && uri.startsWith(contextPath)) {
			uri = uri.substring(contextPath.length());
		}
		return Utils.stripTrailingSlash(uri);
	}

	private void writeEvent(PrintWriter writer, SseEvent event) throws IOException {
		writer.write(event.format());
		writer.flush();
		if (writer.checkError()) {
			throw new IOException("Client disconnected");
		}
	}

	private void writeJson(HttpServletResponse response, int status, String json) throws IOException {
		response.setStatus(status);
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		addNoStoreHeaders(response);
		addCorsHeaders(response);
		PrintWriter writer = response.getWriter();
		writer.write(json);
		writer.flush();
	}

	private void sendAccepted(HttpServletResponse response) {
		response.setStatus(HttpServletResponse.SC_ACCEPTED);
		addNoStoreHeaders(response);
		addCorsHeaders(response);
	}

	private void sendStatus(HttpServletResponse response, int status, String message) throws IOException {
		writeJson(response, status, this.objectMapper.writeValueAsString(Map.of("error", message)));
	}

	private void addNoStoreHeaders(HttpServletResponse response) {
		response.setHeader("Cache-Control", CACHE_CONTROL_NO_STORE);
		response.setHeader("Connection", "keep-alive");
		response.setHeader("X-Accel-Buffering", "no");
	}

	private void addCorsHeaders(HttpServletResponse response) {
		response.setHeader("Access-Control-Allow-Origin", "*");
		response.setHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
		response.setHeader("Access-Control-Allow-Headers", "Content-Type");
	}

	private void completeQuietly(AsyncContext asyncContext, String sessionId) {
		try {
			asyncContext.complete();
		}
		catch (IllegalStateException e) {
			logger.debug("Async context for session {} already completed", sessionId);
		}
	}

	public SessionManager getSessionManager() {
		return this.sessionManager;
	}

	public McpDispatcher getDispatcher() {
		return this.dispatcher;
	}

	public Duration getKeepAliveInterval() {
		return this.heartbeatScheduler.getInterval();
	}

	/**
	 * Stop accepting streams and messages, close every session and release the
	 * transport's threads.
	 * @return a {@link Mono} completing once everything is closed
	 */
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (this.isClosing.compareAndSet(false, true)) {
				logger.info("Closing transport with {} active sessions", this.sessionManager.activeCount());
				this.sessionManager.closeAll();
				this.transportScheduler.dispose();
			}
		});
	}

	@Override
	public void destroy() {
		closeGracefully().block();
		super.destroy();
	}

	/**
	 * Closes the session when the container finishes the async request, whichever way it
	 * ends.
	 */
	private final class SessionAsyncListener implements AsyncListener {

		private final String sessionId;

		private SessionAsyncListener(String sessionId) {
			this.sessionId = sessionId;
		}

		@Override
		public void onComplete(AsyncEvent event) {
			logger.debug("SSE stream for session {} completed", this.sessionId);
			sessionManager.close(this.sessionId);
		}

		@Override
		public void onTimeout(AsyncEvent event) {
			logger.debug("SSE stream for session {} timed out", this.sessionId);
			sessionManager.close(this.sessionId);
		}

		@Override
		public void onError(AsyncEvent event) {
			logger.debug("SSE stream for session {} failed: {}", this.sessionId,
					(event.getThrowable() != null) ? event.getThrowable().getMessage() : "unknown");
			sessionManager.close(this.sessionId);
		}

		@Override
		public void onStartAsync(AsyncEvent event) {
		}

	}

	/**
	 * Builder for {@link HttpServletSseServerTransport}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper;

		private McpDispatcher dispatcher;

		private SessionManager sessionManager;

		private String serviceName = "odoo-mcp-bridge";

		private String sseEndpoint = DEFAULT_SSE_ENDPOINT;

		private String messageEndpoint = DEFAULT_MESSAGE_ENDPOINT;

		private String healthEndpoint = DEFAULT_HEALTH_ENDPOINT;

		private Duration keepAliveInterval = HeartbeatScheduler.DEFAULT_INTERVAL;

		private ResponseDelivery responseDelivery = ResponseDelivery.PULL;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder dispatcher(McpDispatcher dispatcher) {
			this.dispatcher = dispatcher;
			return this;
		}

		public Builder sessionManager(SessionManager sessionManager) {
			this.sessionManager = sessionManager;
			return this;
		}

		public Builder serviceName(String serviceName) {
			Assert.hasText(serviceName, "Service name must not be empty");
			this.serviceName = serviceName;
			return this;
		}

		public Builder sseEndpoint(String sseEndpoint) {
			Assert.hasText(sseEndpoint, "SSE endpoint must not be empty");
			this.sseEndpoint = Utils.stripTrailingSlash(sseEndpoint);
			return this;
		}

		public Builder messageEndpoint(String messageEndpoint) {
			Assert.hasText(messageEndpoint, "Message endpoint must not be empty");
			this.messageEndpoint = Utils.stripTrailingSlash(messageEndpoint);
			return this;
		}

		public Builder healthEndpoint(String healthEndpoint) {
			Assert.hasText(healthEndpoint, "Health endpoint must not be empty");
			this.healthEndpoint = Utils.stripTrailingSlash(healthEndpoint);
			return this;
		}

		public Builder keepAliveInterval(Duration keepAliveInterval) {
			Assert.notNull(keepAliveInterval, "Keep-alive interval must not be null");
			this.keepAliveInterval = keepAliveInterval;
			return this;
		}

		public Builder responseDelivery(ResponseDelivery responseDelivery) {
			Assert.notNull(responseDelivery, "Response delivery must not be null");
			this.responseDelivery = responseDelivery;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "Clock must not be null");
			this.clock = clock;
			return this;
		}

		public HttpServletSseServerTransport build() {
			Assert.notNull(this.dispatcher, "Dispatcher must not be null");
			if (this.objectMapper == null) {
				this.objectMapper = new ObjectMapper();
			}
			if (this.sessionManager == null) {
				this.sessionManager = new SessionManager(this.clock);
			}
			return new HttpServletSseServerTransport(this);
		}

	}

}
