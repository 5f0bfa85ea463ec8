/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.app;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import io.odoomcp.crm.client.OdooClientConfig;
import io.odoomcp.server.ResponseDelivery;
import io.odoomcp.util.Utils;

/**
 * Runtime settings of the bridge.
 * <p>
 * Values come from {@code odoo-mcp.properties} on the classpath. Each key can be
 * overridden by an environment variable named after it in upper case with dots replaced by
 * underscores ({@code odoo.url} becomes {@code ODOO_URL}), and then by a system property
 * with the dotted key.
 * </p>
 */
public final class OdooMcpProperties {

	public static final String RESOURCE = "odoo-mcp.properties";

	static final String HOST = "host";

	static final String PORT = "port";

	static final String SERVICE_NAME = "service.name";

	static final String ODOO_URL = "odoo.url";

	static final String ODOO_DB = "odoo.db";

	static final String ODOO_USERNAME = "odoo.username";

	static final String ODOO_PASSWORD = "odoo.password";

	static final String ODOO_TIMEOUT_SECONDS = "odoo.timeout.seconds";

	static final String HEARTBEAT_SECONDS = "mcp.heartbeat.seconds";

	static final String TOOL_TIMEOUT_SECONDS = "mcp.tool.timeout.seconds";

	static final String SESSION_IDLE_MINUTES = "mcp.session.idle.minutes";

	static final String RESPONSE_DELIVERY = "mcp.response.delivery";

	private static final List<String> KEYS = List.of(HOST, PORT, SERVICE_NAME, ODOO_URL, ODOO_DB, ODOO_USERNAME,
			ODOO_PASSWORD, ODOO_TIMEOUT_SECONDS, HEARTBEAT_SECONDS, TOOL_TIMEOUT_SECONDS, SESSION_IDLE_MINUTES,
			RESPONSE_DELIVERY);

	private final Properties values;

	private OdooMcpProperties(Properties values) {
		this.values = values;
	}

	/**
	 * Load from the classpath resource, the process environment and the system properties.
	 */
	public static OdooMcpProperties load() {
		return load(classpathDefaults(), System.getenv(), System.getProperties());
	}

	static OdooMcpProperties load(Properties defaults, Map<String, String> environment, Properties system) {
		Properties merged = new Properties();
		merged.putAll(defaults);
		for (String key : KEYS) {
			String fromEnvironment = environment.get(environmentName(key));
			if (Utils.hasText(fromEnvironment)) {
				merged.setProperty(key, fromEnvironment.trim());
			}
			String fromSystem = system.getProperty(key);
			if (Utils.hasText(fromSystem)) {
				merged.setProperty(key, fromSystem.trim());
			}
		}
		return new OdooMcpProperties(merged);
	}

	static String environmentName(String key) {
		return key.toUpperCase(Locale.ROOT).replace('.', '_');
	}

	private static Properties classpathDefaults() {
		Properties defaults = new Properties();
		try (InputStream in = OdooMcpProperties.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in != null) {
				defaults.load(in);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Cannot read " + RESOURCE, e);
		}
		return defaults;
	}

	/**
	 * Check that every setting needed to reach Odoo is present and that numeric settings
	 * parse.
	 * @return the problems found, empty when the configuration is usable
	 */
	public List<String> validate() {
		List<String> problems = new ArrayList<>();
		for (String key : List.of(ODOO_URL, ODOO_DB, ODOO_USERNAME, ODOO_PASSWORD)) {
			if (!Utils.hasText(this.values.getProperty(key))) {
				problems.add("Missing " + key + " (environment variable " + environmentName(key) + ")");
			}
		}
		for (String key : List.of(PORT, ODOO_TIMEOUT_SECONDS, HEARTBEAT_SECONDS, TOOL_TIMEOUT_SECONDS,
				SESSION_IDLE_MINUTES)) {
			try {
				if (intValue(key, 1) < 1) {
					problems.add(key + " must be positive");
				}
			}
			catch (NumberFormatException e) {
				problems.add(key + " is not a number: " + this.values.getProperty(key));
			}
		}
		try {
			getResponseDelivery();
		}
		catch (IllegalArgumentException e) {
			problems.add(RESPONSE_DELIVERY + " must be one of pull, push");
		}
		return problems;
	}

	public String getHost() {
		return this.values.getProperty(HOST, "0.0.0.0");
	}

	public int getPort() {
		return intValue(PORT, 8082);
	}

	public String getServiceName() {
		return this.values.getProperty(SERVICE_NAME, "odoo-mcp-bridge");
	}

	public Duration getHeartbeatInterval() {
		return Duration.ofSeconds(intValue(HEARTBEAT_SECONDS, 30));
	}

	public Duration getToolCallTimeout() {
		return Duration.ofSeconds(intValue(TOOL_TIMEOUT_SECONDS, 30));
	}

	public Duration getSessionIdleTimeout() {
		return Duration.ofMinutes(intValue(SESSION_IDLE_MINUTES, 30));
	}

	public ResponseDelivery getResponseDelivery() {
		String delivery = this.values.getProperty(RESPONSE_DELIVERY, "pull");
		return ResponseDelivery.valueOf(delivery.trim().toUpperCase(Locale.ROOT));
	}

	public OdooClientConfig getOdooClientConfig() {
		return new OdooClientConfig(this.values.getProperty(ODOO_URL), this.values.getProperty(ODOO_DB),
				this.values.getProperty(ODOO_USERNAME), this.values.getProperty(ODOO_PASSWORD),
				Duration.ofSeconds(intValue(ODOO_TIMEOUT_SECONDS, 30)));
	}

	private int intValue(String key, int fallback) {
		String value = this.values.getProperty(key);
		return Utils.hasText(value) ? Integer.parseInt(value.trim()) : fallback;
	}

	@Override
	public String toString() {
		return "OdooMcpProperties[host=" + getHost() + ", port=" + this.values.getProperty(PORT) + ", odoo.url="
				+ this.values.getProperty(ODOO_URL) + ", odoo.db=" + this.values.getProperty(ODOO_DB)
				+ ", odoo.username=" + this.values.getProperty(ODOO_USERNAME) + ", odoo.password=****]";
	}

}
