/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.tools;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import io.odoomcp.crm.client.OdooClient;
import io.odoomcp.crm.client.OdooConnectivityException;
import io.odoomcp.spec.InvalidParamsError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Helpers shared by the CRM tool handlers: argument extraction and the reconnect-once
 * policy for backend calls.
 * <p>
 * Arguments are never coerced. A value of the wrong JSON type raises
 * {@link IllegalArgumentException}, which the tool reports as a failed execution; an
 * absent required value is an invalid-params error.
 * </p>
 */
final class OdooToolSupport {

	private static final Logger logger = LoggerFactory.getLogger(OdooToolSupport.class);

	private OdooToolSupport() {
	}

	/**
	 * Run a backend call; if the backend could not be reached, log in again and retry
	 * exactly once. Faults reported by the backend are not retried.
	 */
	static <T> Mono<T> withReconnect(OdooClient client, String toolName, Supplier<Mono<T>> call) {
		return Mono.defer(call).onErrorResume(OdooConnectivityException.class, e -> {
			logger.warn("Tool '{}' lost the Odoo connection ({}), reconnecting once", toolName, e.getMessage());
			return client.reconnect().then(Mono.defer(call));
		});
	}

	static Integer optionalInteger(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		return (value != null) ? toInteger(name, value) : null;
	}

	private static int toInteger(String name, Object value) {
		if (value instanceof Number number) {
			BigDecimal decimal = new BigDecimal(number.toString());
			try {
				return decimal.intValueExact();
			}
			catch (ArithmeticException e) {
				throw new IllegalArgumentException("Argument '" + name + "' must be an integer, got " + value);
			}
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be an integer, got " + value);
	}

	static int requiredInteger(Map<String, Object> arguments, String name) {
		Integer value = optionalInteger(arguments, name);
		if (value == null) {
			throw new InvalidParamsError("Missing required argument: " + name);
		}
		return value;
	}

	static String optionalString(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof String string) {
			return string;
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be a string, got " + value);
	}

	static String requiredString(Map<String, Object> arguments, String name) {
		String value = optionalString(arguments, name);
		if (value == null || value.isBlank()) {
			throw new InvalidParamsError("Missing required argument: " + name);
		}
		return value;
	}

	static Number optionalNumber(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof Number number) {
			return number;
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be a number, got " + value);
	}

	static List<Integer> optionalIntegerList(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		if (value == null) {
			return null;
		}
		if (!(value instanceof List<?> items)) {
			throw new IllegalArgumentException("Argument '" + name + "' must be a list of integers, got " + value);
		}
		List<Integer> ids = new ArrayList<>(items.size());
		for (Object item : items) {
			ids.add(toInteger(name, item));
		}
		return ids;
	}

	static Boolean optionalBoolean(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		if (value == null) {
			return null;
		}
		if (value instanceof Boolean flag) {
			return flag;
		}
		throw new IllegalArgumentException("Argument '" + name + "' must be a boolean, got " + value);
	}

}
