/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.odoomcp.spec.McpSchema;
import io.odoomcp.spec.McpSchema.JSONRPCResponse;
import io.odoomcp.spec.ProtocolVersions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link McpDispatcher}.
 */
class McpDispatcherTests {

	private static final String LEAD_SCHEMA = """
			{
				"type": "object",
				"properties": { "lead_id": { "type": "integer" } },
				"required": ["lead_id"]
			}
			""";

	private final ObjectMapper mapper = new ObjectMapper();

	private final AtomicReference<ToolCallContext> lastContext = new AtomicReference<>();

	private final AtomicReference<Map<String, Object>> lastArguments = new AtomicReference<>();

	private InitializationState initializationState;

	private McpDispatcher dispatcher;

	@BeforeEach
	void setUp() {
		initializationState = new InitializationState(new McpSchema.Implementation("mcp-odoo-simple", "1.0.0"),
				McpSchema.ServerCapabilities.staticToolsAndResources(), null);

		ToolRegistry registry = ToolRegistry.builder()
			.register(new McpServerFeatures.AsyncToolSpecification(
					McpSchema.Tool.builder().name("odoo_version").description("Odoo server version").build(),
					(context, arguments) -> {
						lastContext.set(context);
						lastArguments.set(arguments);
						return Mono.just(Map.of("server_version", "17.0"));
					}))
			.register(new McpServerFeatures.AsyncToolSpecification(
					McpSchema.Tool.builder()
						.name("get_lead_details")
						.description("Lead by id")
						.inputSchema(mapper, LEAD_SCHEMA)
						.build(),
					(context, arguments) -> Mono.just(Map.of("id", arguments.get("lead_id")))))
			.register(McpServerFeatures.AsyncToolSpecification.builder()
				.tool(McpSchema.Tool.builder().name("slow").build())
				.syncCallHandler((context, arguments) -> {
					Thread.sleep(500);
					return "slow";
				})
				.build())
			.register(new McpServerFeatures.AsyncToolSpecification(McpSchema.Tool.builder().name("fast").build(),
					(context, arguments) -> Mono.just("fast")))
			.register(new McpServerFeatures.AsyncToolSpecification(McpSchema.Tool.builder().name("hangs").build(),
					(context, arguments) -> Mono.never(), Duration.ofMillis(100)))
			.register(new McpServerFeatures.AsyncToolSpecification(McpSchema.Tool.builder().name("broken").build(),
					(context, arguments) -> Mono.error(new IllegalStateException("backend unreachable"))))
			.register(new McpServerFeatures.AsyncToolSpecification(McpSchema.Tool.builder().name("silent").build(),
					(context, arguments) -> Mono.empty()))
			.build();

		dispatcher = McpDispatcher.builder()
			.objectMapper(mapper)
			.toolRegistry(registry)
			.initializationState(initializationState)
			.build();
	}

	private static String call(Object id, String tool, String arguments) {
		String args = (arguments != null) ? ",\"arguments\":" + arguments : "";
		return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"tools/call\",\"params\":{\"name\":\"" + tool + "\""
				+ args + "}}";
	}

	private static void assertError(JSONRPCResponse response, Object id, int code) {
		assertThat(response.id()).isEqualTo(id);
		assertThat(response.result()).isNull();
		assertThat(response.error()).isNotNull();
		assertThat(response.error().code()).isEqualTo(code);
	}

	@Test
	void testInitialize() {
		String body = """
				{"jsonrpc":"2.0","id":1,"method":"initialize","params":{"protocolVersion":"2024-11-05",
				"capabilities":{},"clientInfo":{"name":"test-client","version":"1.0.0"}}}
				""";

		StepVerifier.create(dispatcher.dispatch(body)).assertNext(response -> {
			assertThat(response.id()).isEqualTo(1);
			assertThat(response.error()).isNull();
			McpSchema.InitializeResult result = (McpSchema.InitializeResult) response.result();
			assertThat(result.protocolVersion()).isEqualTo("2024-11-05");
			assertThat(result.serverInfo().name()).isEqualTo("mcp-odoo-simple");
			assertThat(result.capabilities().tools().listChanged()).isFalse();
			assertThat(result.capabilities().resources().listChanged()).isFalse();
		}).verifyComplete();

		assertThat(initializationState.isInitialized()).isTrue();
	}

	@Test
	void testInitializeNegotiatesSupportedVersionAndFallsBack() {
		String newer = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":\"2025-03-26\"}}";
		StepVerifier.create(dispatcher.dispatch(newer))
			.assertNext(response -> assertThat(((McpSchema.InitializeResult) response.result()).protocolVersion())
				.isEqualTo(ProtocolVersions.MCP_2025_03_26))
			.verifyComplete();

		assertThat(InitializationState.negotiate("1999-01-01")).isEqualTo(ProtocolVersions.MCP_2024_11_05);
		assertThat(InitializationState.negotiate(null)).isEqualTo(ProtocolVersions.MCP_2024_11_05);
	}

	@Test
	void testRepeatedInitializeReturnsFirstResult() {
		String first = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":\"2025-06-18\"}}";
		String second = "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"initialize\",\"params\":{\"protocolVersion\":\"2024-11-05\"}}";

		JSONRPCResponse r1 = dispatcher.dispatch(first).block();
		JSONRPCResponse r2 = dispatcher.dispatch(second).block();

		assertThat(r2.id()).isEqualTo(2);
		assertThat(r2.result()).isEqualTo(r1.result());
		assertThat(initializationState.protocolVersion()).isEqualTo(ProtocolVersions.MCP_2025_06_18);
	}

	@Test
	void testToolsListIncludesOdooVersion() {
		StepVerifier.create(dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}"))
			.assertNext(response -> {
				assertThat(response.id()).isEqualTo(2);
				McpSchema.ListToolsResult result = (McpSchema.ListToolsResult) response.result();
				assertThat(result.tools()).extracting(McpSchema.Tool::name).contains("odoo_version");
				assertThat(result.tools()).allSatisfy(tool -> assertThat(tool.inputSchema()).isNotNull());
			})
			.verifyComplete();
	}

	@Test
	void testToolsListIsIdempotent() {
		String body = "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/list\"}";

		JSONRPCResponse first = dispatcher.dispatch(body).block();
		JSONRPCResponse second = dispatcher.dispatch(body).block();

		assertThat(second).isEqualTo(first);
	}

	@Test
	void testIdIsEchoedVerbatim() {
		StepVerifier.create(dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"id\":\"req-42\",\"method\":\"ping\"}"))
			.assertNext(response -> {
				assertThat(response.id()).isEqualTo("req-42");
				assertThat(response.result()).isEqualTo(Map.of());
			})
			.verifyComplete();

		StepVerifier.create(dispatcher.dispatch(call(99, "odoo_version", "{}")))
			.assertNext(response -> assertThat(response.id()).isEqualTo(99))
			.verifyComplete();
	}

	@Test
	void testNotificationsProduceNoResponse() {
		StepVerifier.create(dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"))
			.verifyComplete();
		StepVerifier.create(dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/cancelled\"}"))
			.verifyComplete();
	}

	@Test
	void testUnknownMethod() {
		StepVerifier.create(dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"unknown_method\"}"))
			.assertNext(response -> {
				assertError(response, 7, McpSchema.ErrorCodes.METHOD_NOT_FOUND);
				assertThat(response.error().message()).contains("unknown_method");
			})
			.verifyComplete();
	}

	@Test
	void testUnknownTool() {
		StepVerifier.create(dispatcher.dispatch(call(5, "does_not_exist", "{}"))).assertNext(response -> {
			assertError(response, 5, McpSchema.ErrorCodes.INVALID_PARAMS);
			assertThat(response.error().message()).isEqualTo("Unknown tool: does_not_exist");
		}).verifyComplete();
	}

	@Test
	void testInvalidJsonIsParseError() {
		StepVerifier.create(dispatcher.dispatch("{\"jsonrpc\":"))
			.assertNext(response -> assertError(response, null, McpSchema.ErrorCodes.PARSE_ERROR))
			.verifyComplete();
	}

	@Test
	void testMissingMethodIsInvalidRequest() {
		StepVerifier.create(dispatcher.dispatch("{\"jsonrpc\":\"2.0\",\"id\":11}"))
			.assertNext(response -> assertError(response, 11, McpSchema.ErrorCodes.INVALID_REQUEST))
			.verifyComplete();
	}

	@Test
	void testToolCallWithoutNameIsInvalidParams() {
		String body = "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/call\",\"params\":{\"arguments\":{}}}";

		StepVerifier.create(dispatcher.dispatch(body))
			.assertNext(response -> assertError(response, 4, McpSchema.ErrorCodes.INVALID_PARAMS))
			.verifyComplete();
	}

	@Test
	void testMissingRequiredArgumentIsInvalidParams() {
		StepVerifier.create(dispatcher.dispatch(call(8, "get_lead_details", "{}"))).assertNext(response -> {
			assertError(response, 8, McpSchema.ErrorCodes.INVALID_PARAMS);
			assertThat(response.error().message()).contains("lead_id");
		}).verifyComplete();
	}

	@Test
	void testArgumentsAreNotCoerced() {
		StepVerifier.create(dispatcher.dispatch(call(9, "get_lead_details", "{\"lead_id\":\"12\"}")))
			.assertNext(response -> assertThat(response.result()).isEqualTo(Map.of("id", "12")))
			.verifyComplete();
	}

	@Test
	void testAbsentArgumentsBecomeEmptyMapAndContextIsPopulated() {
		StepVerifier.create(dispatcher.dispatch(call(10, "odoo_version", null), "abc123"))
			.assertNext(response -> assertThat(response.result()).isEqualTo(Map.of("server_version", "17.0")))
			.verifyComplete();

		assertThat(lastArguments.get()).isEmpty();
		assertThat(lastContext.get().toolName()).isEqualTo("odoo_version");
		assertThat(lastContext.get().requestId()).isEqualTo(10);
		assertThat(lastContext.get().sessionId()).isEqualTo("abc123");
		assertThat(lastContext.get().hasSession()).isTrue();
	}

	@Test
	void testHandlerFailureIsToolExecutionError() {
		StepVerifier.create(dispatcher.dispatch(call(12, "broken", "{}"))).assertNext(response -> {
			assertError(response, 12, McpSchema.ErrorCodes.INTERNAL_ERROR);
			assertThat(response.error().message()).isEqualTo("Tool execution failed: backend unreachable");
		}).verifyComplete();
	}

	@Test
	void testHandlerTimeoutIsToolExecutionError() {
		StepVerifier.create(dispatcher.dispatch(call(13, "hangs", "{}"))).assertNext(response -> {
			assertError(response, 13, McpSchema.ErrorCodes.INTERNAL_ERROR);
			assertThat(response.error().message()).contains("timed out");
		}).verifyComplete();
	}

	@Test
	void testEmptyHandlerResultIsEmptyObject() {
		StepVerifier.create(dispatcher.dispatch(call(14, "silent", "{}")))
			.assertNext(response -> assertThat(response.result()).isEqualTo(Map.of()))
			.verifyComplete();
	}

	@Test
	void testSlowToolDoesNotDelayFastTool() {
		List<String> completionOrder = new CopyOnWriteArrayList<>();

		Mono<JSONRPCResponse> slow = dispatcher.dispatch(call(1, "slow", "{}"))
			.doOnNext(response -> completionOrder.add((String) response.result()));
		Mono<JSONRPCResponse> fast = dispatcher.dispatch(call(2, "fast", "{}"))
			.doOnNext(response -> completionOrder.add((String) response.result()));

		StepVerifier.create(Flux.merge(slow, fast)).expectNextCount(2).verifyComplete();

		assertThat(completionOrder).containsExactly("fast", "slow");
	}

	@Test
	void testToolCallBeforeInitializeIsServedByDefault() {
		assertThat(initializationState.isInitialized()).isFalse();

		StepVerifier.create(dispatcher.dispatch(call(15, "odoo_version", "{}")))
			.assertNext(response -> assertThat(response.error()).isNull())
			.verifyComplete();
	}

	@Test
	void testStrictInitializationRejectsEarlyToolCalls() {
		McpDispatcher strict = McpDispatcher.builder()
			.objectMapper(mapper)
			.toolRegistry(dispatcher.getToolRegistry())
			.initializationState(initializationState)
			.strictInitialization(true)
			.build();

		StepVerifier.create(strict.dispatch(call(16, "odoo_version", "{}")))
			.assertNext(response -> assertError(response, 16, McpSchema.ErrorCodes.INVALID_REQUEST))
			.verifyComplete();

		strict.dispatch("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}").block();

		StepVerifier.create(strict.dispatch(call(17, "odoo_version", "{}")))
			.assertNext(response -> assertThat(response.error()).isNull())
			.verifyComplete();
	}

	@Test
	void testResponseSerializesToWireFormat() throws Exception {
		JSONRPCResponse response = dispatcher.dispatch(call(18, "odoo_version", "{}")).block();

		Map<String, Object> wire = mapper.readValue(mapper.writeValueAsString(response), McpSchema.MAP_TYPE_REF);

		assertThat(wire).isEqualTo(Map.of("jsonrpc", "2.0", "id", 18, "result", Map.of("server_version", "17.0")));
	}

}
