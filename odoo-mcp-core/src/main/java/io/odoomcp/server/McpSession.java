/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * One open SSE stream. Events for the client are pushed into an outbound sink that the
 * transport drains onto the servlet response.
 */
public class McpSession {

	private static final Logger logger = LoggerFactory.getLogger(McpSession.class);

	private final String id;

	private final Clock clock;

	private final Instant createdAt;

	private final AtomicReference<Instant> lastActivity;

	private final AtomicBoolean open = new AtomicBoolean(true);

	private final Sinks.Many<SseEvent> outbound = Sinks.many().unicast().onBackpressureBuffer();

	private final AtomicReference<Disposable> heartbeat = new AtomicReference<>();

	McpSession(String id, Clock clock) {
		this.id = id;
		this.clock = clock;
		this.createdAt = clock.instant();
		this.lastActivity = new AtomicReference<>(this.createdAt);
	}

	public String getId() {
		return this.id;
	}

	public Instant getCreatedAt() {
		return this.createdAt;
	}

	public Instant getLastActivity() {
		return this.lastActivity.get();
	}

	public boolean isOpen() {
		return this.open.get();
	}

	void touch() {
		this.lastActivity.set(this.clock.instant());
	}

	/**
	 * Events queued for this session's stream. May be subscribed to once.
	 * @return the outbound events, completing when the session closes
	 */
	public Flux<SseEvent> events() {
		return this.outbound.asFlux();
	}

	/**
	 * Queue an event for the stream.
	 * @param event the event
	 * @return {@code false} if the session is closed or the event could not be queued
	 */
	public synchronized boolean send(SseEvent event) {
		if (!isOpen()) {
			logger.debug("Dropping {} event for closed session {}", event.event(), this.id);
			return false;
		}
		Sinks.EmitResult result = this.outbound.tryEmitNext(event);
		if (result.isFailure()) {
			logger.warn("Failed to queue {} event for session {}: {}", event.event(), this.id, result);
			return false;
		}
		return true;
	}

	/**
	 * Attach the heartbeat subscription so that closing the session cancels it. A
	 * heartbeat attached to an already closed session is disposed immediately.
	 * @param subscription the heartbeat subscription
	 */
	public void attachHeartbeat(Disposable subscription) {
		Disposable previous = this.heartbeat.getAndSet(subscription);
		if (previous != null) {
			previous.dispose();
		}
		if (!isOpen()) {
			subscription.dispose();
		}
	}

	boolean close() {
		if (!this.open.compareAndSet(true, false)) {
			return false;
		}
		Disposable subscription = this.heartbeat.getAndSet(null);
		if (subscription != null) {
			subscription.dispose();
		}
		synchronized (this) {
			this.outbound.tryEmitComplete();
		}
		return true;
	}

	@Override
	public String toString() {
		return "McpSession[id=" + this.id + ", open=" + isOpen() + "]";
	}

}
