/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import io.odoomcp.util.Assert;

/**
 * A single server-sent event.
 *
 * @param event the event type
 * @param data the payload; multi-line payloads are split over several {@code data:} lines
 */
public record SseEvent(String event, String data) {

	public static final String ENDPOINT = "endpoint";

	public static final String SESSION = "session";

	public static final String READY = "ready";

	public static final String HEARTBEAT = "heartbeat";

	public static final String MESSAGE = "message";

	public SseEvent {
		Assert.hasText(event, "Event type must not be empty");
		Assert.notNull(data, "Event data must not be null");
	}

	/**
	 * Wire representation terminated by the blank line that ends an event.
	 * @return the formatted event
	 */
	public String format() {
		StringBuilder sb = new StringBuilder("event: ").append(this.event).append('\n');
		for (String line : this.data.split("\r\n|\r|\n", -1)) {
			sb.append("data: ").append(line).append('\n');
		}
		return sb.append('\n').toString();
	}

}
