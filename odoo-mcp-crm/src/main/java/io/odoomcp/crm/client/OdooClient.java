/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.client;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Reactive access to an Odoo server's external API.
 * <p>
 * Implementations must be safe for concurrent use: tool calls from several clients reach
 * the same instance at once. Failures to reach the server surface as
 * {@link OdooConnectivityException}; faults reported by the server surface as
 * {@link OdooRpcException}.
 * </p>
 */
public interface OdooClient {

	/**
	 * Authenticate against the configured database. Completes once the session user id
	 * is known.
	 * @return completion signal
	 */
	Mono<Void> connect();

	/**
	 * Drop the current login and authenticate again.
	 * @return completion signal
	 */
	Mono<Void> reconnect();

	boolean isConnected();

	/**
	 * {@code search_read} on a model.
	 * @param model the model name, e.g. {@code crm.lead}
	 * @param domain the search domain as a list of {@code [field, operator, value]} triples
	 * @param fields the fields to read, empty for all
	 * @param limit maximum number of records, {@code null} for no limit
	 * @param order sort specification, {@code null} for the model default
	 * @return the matching records
	 */
	Mono<List<Map<String, Object>>> searchRead(String model, List<List<Object>> domain, List<String> fields,
			Integer limit, String order);

	/**
	 * Generic {@code execute_kw} call.
	 * @param model the model name
	 * @param method the model method
	 * @param args positional arguments
	 * @param kwargs keyword arguments
	 * @return the decoded result (a {@code Map}, {@code List}, number, string or boolean)
	 */
	Mono<Object> executeKw(String model, String method, List<Object> args, Map<String, Object> kwargs);

	/**
	 * The server version string, e.g. {@code 17.0}. Needs no login.
	 * @return the version
	 */
	Mono<String> getServerVersion();

	String getUrl();

	String getDatabase();

}
