/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code GET /health}.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record HealthStatus( // @formatter:off
	@JsonProperty("status") String status,
	@JsonProperty("service") String service,
	@JsonProperty("tools_loaded") int toolsLoaded,
	@JsonProperty("initialized") boolean initialized,
	@JsonProperty("active_sessions") int activeSessions,
	@JsonProperty("timestamp") String timestamp) { // @formatter:on

	public static final String HEALTHY = "healthy";

}
