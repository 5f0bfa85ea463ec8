/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.client;

/**
 * The Odoo server could not be reached or answered with something other than a
 * JSON-RPC payload. Usually transient; callers may reconnect and retry.
 */
public class OdooConnectivityException extends RuntimeException {

	public OdooConnectivityException(String message) {
		super(message);
	}

	public OdooConnectivityException(String message, Throwable cause) {
		super(message, cause);
	}

}
