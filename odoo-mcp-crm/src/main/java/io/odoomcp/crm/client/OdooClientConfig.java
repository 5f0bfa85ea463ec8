/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.crm.client;

import java.time.Duration;

import io.odoomcp.util.Assert;
import io.odoomcp.util.Utils;

/**
 * Connection settings for an Odoo server.
 *
 * @param url base URL of the server, without the {@code /jsonrpc} suffix
 * @param database the database to log into
 * @param username login name
 * @param password password or API key
 * @param requestTimeout upper bound for one HTTP round trip
 */
public record OdooClientConfig(String url, String database, String username, String password,
		Duration requestTimeout) {

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public OdooClientConfig {
		Assert.hasText(url, "Odoo URL must not be empty");
		Assert.hasText(database, "Odoo database must not be empty");
		Assert.hasText(username, "Odoo username must not be empty");
		Assert.notNull(password, "Odoo password must not be null");
		url = Utils.stripTrailingSlash(url.trim());
		if (requestTimeout == null) {
			requestTimeout = DEFAULT_REQUEST_TIMEOUT;
		}
	}

	public OdooClientConfig(String url, String database, String username, String password) {
		this(url, database, username, password, DEFAULT_REQUEST_TIMEOUT);
	}

	@Override
	public String toString() {
		return "OdooClientConfig[url=" + this.url + ", database=" + this.database + ", username=" + this.username
				+ ", requestTimeout=" + this.requestTimeout + "]";
	}

}
