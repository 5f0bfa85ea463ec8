/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.odoomcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link OdooClient} speaking Odoo's JSON-RPC protocol over {@link HttpClient}.
 * <p>
 * Every call is a {@code POST {url}/jsonrpc} with a {@code call} envelope naming the
 * service ({@code common} or {@code object}), the service method and its positional
 * arguments. The user id obtained from {@code common.login} is cached and reused until
 * {@link #reconnect()} is called; model calls log in on first use.
 * </p>
 */
public class JsonRpcOdooClient implements OdooClient {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcOdooClient.class);

	private static final TypeReference<List<Map<String, Object>>> RECORDS_TYPE_REF = new TypeReference<>() {
	};

	public static final String JSONRPC_PATH = "/jsonrpc";

	private final OdooClientConfig config;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final URI endpoint;

	private final AtomicReference<Integer> uid = new AtomicReference<>();

	private final AtomicReference<Mono<Integer>> pendingLogin = new AtomicReference<>();

	private final AtomicLong requestIds = new AtomicLong();

	public JsonRpcOdooClient(OdooClientConfig config, ObjectMapper objectMapper) {
		this(config, objectMapper, HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build());
	}

	public JsonRpcOdooClient(OdooClientConfig config, ObjectMapper objectMapper, HttpClient httpClient) {
		Assert.notNull(config, "Config must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.notNull(httpClient, "HttpClient must not be null");
		this.config = config;
		this.objectMapper = objectMapper;
		this.httpClient = httpClient;
		this.endpoint = URI.create(config.url() + JSONRPC_PATH);
	}

	@Override
	public Mono<Void> connect() {
		return login().then();
	}

	@Override
	public Mono<Void> reconnect() {
		this.uid.set(null);
		this.pendingLogin.set(null);
		logger.info("Reconnecting to Odoo at {}", this.config.url());
		return connect();
	}

	@Override
	public boolean isConnected() {
		return this.uid.get() != null;
	}

	@Override
	public Mono<List<Map<String, Object>>> searchRead(String model, List<List<Object>> domain, List<String> fields,
			Integer limit, String order) {
		Map<String, Object> kwargs = new LinkedHashMap<>();
		kwargs.put("fields", (fields != null) ? fields : List.of());
		if (limit != null) {
			kwargs.put("limit", limit);
		}
		if (order != null) {
			kwargs.put("order", order);
		}
		return executeKw(model, "search_read", List.of((domain != null) ? domain : List.of()), kwargs)
			.map(result -> this.objectMapper.convertValue(result, RECORDS_TYPE_REF));
	}

	@Override
	public Mono<Object> executeKw(String model, String method, List<Object> args, Map<String, Object> kwargs) {
		Assert.hasText(model, "Model must not be empty");
		Assert.hasText(method, "Method must not be empty");
		return login().flatMap(userId -> {
			logger.debug("execute_kw {}.{}", model, method);
			return call("object", "execute_kw", this.config.database(), userId, this.config.password(), model,
					method, (args != null) ? args : List.of(), (kwargs != null) ? kwargs : Map.of());
		}).map(this::toValue);
	}

	@Override
	public Mono<String> getServerVersion() {
		return call("common", "version").map(result -> {
			JsonNode version = result.get("server_version");
			if (version == null || !version.isTextual()) {
				throw new OdooRpcException("Odoo version response carries no server_version: " + result);
			}
			return version.asText();
		});
	}

	@Override
	public String getUrl() {
		return this.config.url();
	}

	@Override
	public String getDatabase() {
		return this.config.database();
	}

	private Mono<Integer> login() {
		Integer current = this.uid.get();
		if (current != null) {
			return Mono.just(current);
		}
		Mono<Integer> login = this.pendingLogin.get();
		if (login == null) {
			Mono<Integer> fresh = call("common", "login", this.config.database(), this.config.username(),
					this.config.password())
				.map(result -> {
					if (!result.isInt()) {
						throw new OdooRpcException("Authentication failed for user '" + this.config.username()
								+ "' on database '" + this.config.database() + "'");
					}
					return result.asInt();
				})
				.doOnNext(userId -> {
					this.uid.set(userId);
					logger.info("Logged into Odoo {} database {} as uid {}", this.config.url(),
							this.config.database(), userId);
				})
				.doOnError(error -> this.pendingLogin.set(null))
				.cache();
			login = this.pendingLogin.compareAndSet(null, fresh) ? fresh : this.pendingLogin.get();
			if (login == null) {
				login = fresh;
			}
		}
		return login;
	}

	private Mono<JsonNode> call(String service, String method, Object... args) {
		return Mono.defer(() -> {
			long id = this.requestIds.incrementAndGet();
			Map<String, Object> params = new LinkedHashMap<>();
			params.put("service", service);
			params.put("method", method);
			params.put("args", Arrays.asList(args));
			Map<String, Object> envelope = new LinkedHashMap<>();
			envelope.put("jsonrpc", "2.0");
			envelope.put("method", "call");
			envelope.put("params", params);
			envelope.put("id", id);

			String body;
			try {
				body = this.objectMapper.writeValueAsString(envelope);
			}
			catch (JsonProcessingException e) {
				return Mono.error(new IllegalArgumentException("Arguments are not serializable", e));
			}

			HttpRequest request = HttpRequest.newBuilder(this.endpoint)
				.timeout(this.config.requestTimeout())
				.header("Content-Type", "application/json")
				.header("Accept", "application/json")
				.POST(BodyPublishers.ofString(body))
				.build();

			return Mono.fromFuture(() -> this.httpClient.sendAsync(request, BodyHandlers.ofString()))
				.onErrorMap(IOException.class,
						e -> new OdooConnectivityException("Cannot reach Odoo at " + this.config.url() + ": "
								+ ((e.getMessage() != null) ? e.getMessage() : e.getClass().getSimpleName()), e))
				.map(response -> decode(service, method, response));
		});
	}

	private JsonNode decode(String service, String method, HttpResponse<String> response) {
		if (response.statusCode() != 200) {
			throw new OdooConnectivityException(
					"Odoo answered " + service + "." + method + " with HTTP " + response.statusCode());
		}
		JsonNode payload;
		try {
			payload = this.objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw new OdooConnectivityException("Odoo answered " + service + "." + method + " with invalid JSON", e);
		}
		if (payload == null || !payload.isObject()) {
			throw new OdooConnectivityException("Odoo answered " + service + "." + method + " with a non-object");
		}
		JsonNode error = payload.get("error");
		if (error != null && !error.isNull()) {
			throw toRpcException(error);
		}
		JsonNode result = payload.get("result");
		return (result != null) ? result : NullNode.getInstance();
	}

	private OdooRpcException toRpcException(JsonNode error) {
		JsonNode data = error.get("data");
		String message = null;
		if (data != null && data.hasNonNull("message")) {
			message = data.get("message").asText();
		}
		if (message == null || message.isBlank()) {
			message = error.path("message").asText("Odoo server error");
		}
		Integer code = error.hasNonNull("code") ? error.get("code").asInt() : null;
		return new OdooRpcException(code, message);
	}

	private Object toValue(JsonNode node) {
		try {
			return this.objectMapper.treeToValue(node, Object.class);
		}
		catch (JsonProcessingException e) {
			throw new OdooConnectivityException("Cannot decode Odoo result", e);
		}
	}

}
