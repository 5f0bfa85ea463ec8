/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.client;

/**
 * The Odoo server processed the call and reported a fault, such as an access error,
 * a validation error or a failed login.
 */
public class OdooRpcException extends RuntimeException {

	private final Integer code;

	public OdooRpcException(String message) {
		this(null, message);
	}

	public OdooRpcException(Integer code, String message) {
		super(message);
		this.code = code;
	}

	/**
	 * The fault code of the JSON-RPC error object, when the server sent one.
	 * @return the code or {@code null}
	 */
	public Integer getCode() {
		return this.code;
	}

}
