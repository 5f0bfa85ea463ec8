/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.spec;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link McpSchema} message decoding and encoding.
 */
class McpSchemaTests {

	private final ObjectMapper mapper = new ObjectMapper();

	@Test
	void testDeserializeRequestWithNumericId() throws Exception {
		McpSchema.JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"tools/list\"}");

		assertThat(message).isInstanceOf(McpSchema.JSONRPCRequest.class);
		McpSchema.JSONRPCRequest request = (McpSchema.JSONRPCRequest) message;
		assertThat(request.id()).isEqualTo(7);
		assertThat(request.method()).isEqualTo("tools/list");
		assertThat(request.params()).isNull();
	}

	@Test
	void testDeserializeRequestWithStringId() throws Exception {
		McpSchema.JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"id\":\"abc-1\",\"method\":\"ping\",\"params\":{}}");

		assertThat(((McpSchema.JSONRPCRequest) message).id()).isEqualTo("abc-1");
	}

	@Test
	void testMessageWithoutIdIsNotification() throws Exception {
		McpSchema.JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

		assertThat(message).isInstanceOf(McpSchema.JSONRPCNotification.class);
		assertThat(message.jsonrpc()).isEqualTo("2.0");
	}

	@Test
	void testMessageWithNullIdIsNotification() throws Exception {
		McpSchema.JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"notifications/initialized\"}");

		assertThat(message).isInstanceOf(McpSchema.JSONRPCNotification.class);
	}

	@Test
	void testInvalidJsonIsIoError() {
		assertThatThrownBy(() -> McpSchema.deserializeJsonRpcMessage(mapper, "{not json"))
			.isInstanceOf(JsonProcessingException.class);
	}

	@Test
	void testMissingMethodIsRejected() {
		assertThatThrownBy(() -> McpSchema.deserializeJsonRpcMessage(mapper, "{\"jsonrpc\":\"2.0\",\"id\":1}"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("method");
	}

	@Test
	void testNonObjectIsRejected() {
		assertThatThrownBy(() -> McpSchema.deserializeJsonRpcMessage(mapper, "[1,2,3]"))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testExtractRequestId() {
		assertThat(McpSchema.extractRequestId(mapper, "{\"id\":42}")).isEqualTo(42);
		assertThat(McpSchema.extractRequestId(mapper, "{\"method\":\"x\"}")).isNull();
		assertThat(McpSchema.extractRequestId(mapper, "garbage")).isNull();
	}

	@Test
	void testResponseAlwaysWritesIdAndOnlyOneOfResultOrError() throws Exception {
		String failure = mapper.writeValueAsString(McpSchema.JSONRPCResponse.failure(null,
				new McpSchema.JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.PARSE_ERROR, "Parse error", null)));
		Map<String, Object> decoded = mapper.readValue(failure, McpSchema.MAP_TYPE_REF);

		assertThat(decoded).containsEntry("jsonrpc", "2.0").containsKey("id").doesNotContainKey("result");
		assertThat(decoded.get("id")).isNull();
		assertThat(decoded.get("error")).isEqualTo(Map.of("code", -32700, "message", "Parse error"));

		String success = mapper.writeValueAsString(McpSchema.JSONRPCResponse.success(3, Map.of("ok", true)));
		assertThat(mapper.readValue(success, McpSchema.MAP_TYPE_REF))
			.isEqualTo(Map.of("jsonrpc", "2.0", "id", 3, "result", Map.of("ok", true)));
	}

	@Test
	void testToolBuilderParsesSchema() {
		McpSchema.Tool tool = McpSchema.Tool.builder()
			.name("get_lead_details")
			.description("Lead by id")
			.inputSchema(mapper, """
					{
						"type": "object",
						"properties": { "lead_id": { "type": "integer" } },
						"required": ["lead_id"]
					}
					""")
			.build();

		assertThat(tool.inputSchema().type()).isEqualTo("object");
		assertThat(tool.inputSchema().required()).containsExactly("lead_id");
		assertThat(tool.inputSchema().properties()).containsKey("lead_id");
	}

	@Test
	void testToolBuilderDefaultsToEmptyObjectSchema() {
		McpSchema.Tool tool = McpSchema.Tool.builder().name("odoo_version").build();

		assertThat(tool.inputSchema()).isEqualTo(McpSchema.JsonSchema.emptyObject());
		assertThat(tool.inputSchema().requiredOrEmpty()).isEmpty();
	}

	@Test
	void testToolBuilderRejectsMissingName() {
		assertThatThrownBy(() -> McpSchema.Tool.builder().description("nameless").build())
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testCallToolRequestArgumentsDefaultToEmpty() {
		assertThat(new McpSchema.CallToolRequest("x", null).argumentsOrEmpty()).isEmpty();
		assertThat(new McpSchema.CallToolRequest("x", Map.of("a", 1)).argumentsOrEmpty()).containsEntry("a", 1);
	}

	@Test
	void testInitializeResultSerialization() throws Exception {
		McpSchema.InitializeResult result = new McpSchema.InitializeResult(ProtocolVersions.MCP_2024_11_05,
				McpSchema.ServerCapabilities.staticToolsAndResources(),
				new McpSchema.Implementation("mcp-odoo-simple", "1.0.0"), null);

		Map<String, Object> decoded = mapper.readValue(mapper.writeValueAsString(result), McpSchema.MAP_TYPE_REF);

		assertThat(decoded).containsEntry("protocolVersion", "2024-11-05")
			.containsEntry("capabilities",
					Map.of("tools", Map.of("listChanged", false), "resources", Map.of("listChanged", false)))
			.containsEntry("serverInfo", Map.of("name", "mcp-odoo-simple", "version", "1.0.0"))
			.doesNotContainKey("instructions");
		assertThat(ProtocolVersions.SUPPORTED).contains((String) decoded.get("protocolVersion"));
	}

}
