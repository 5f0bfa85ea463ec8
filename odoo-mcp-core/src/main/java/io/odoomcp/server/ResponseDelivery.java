/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

/**
 * Where the response to a {@code POST /messages} is delivered.
 */
public enum ResponseDelivery {

	/**
	 * The POST response body carries the JSON-RPC response.
	 */
	PULL,

	/**
	 * The JSON-RPC response is written as a {@code message} event on the SSE stream named by
	 * the {@code session_id} query parameter and the POST is answered with 202. Without an
	 * open session the response falls back to {@link #PULL}.
	 */
	PUSH

}
