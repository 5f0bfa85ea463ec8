/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server.transport;

import java.time.Clock;
import java.time.Duration;

import io.odoomcp.server.McpSession;
import io.odoomcp.server.SseEvent;
import io.odoomcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * Emits a {@code heartbeat} event on every open SSE stream at a fixed interval, so that
 * proxies keep the connection alive and dead clients are detected by the failed write.
 * <p>
 * Each session gets its own {@link Flux#interval} ticking on the transport's scheduler;
 * the subscription is attached to the session and cancelled when it closes.
 * </p>
 */
public class HeartbeatScheduler {

	private static final Logger logger = LoggerFactory.getLogger(HeartbeatScheduler.class);

	public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

	private final Duration interval;

	private final Scheduler scheduler;

	private final Clock clock;

	public HeartbeatScheduler(Duration interval, Scheduler scheduler) {
		this(interval, scheduler, Clock.systemUTC());
	}

	public HeartbeatScheduler(Duration interval, Scheduler scheduler, Clock clock) {
		Assert.notNull(interval, "Interval must not be null");
		Assert.isTrue(!interval.isNegative() && !interval.isZero(), "Interval must be positive");
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.notNull(clock, "Clock must not be null");
		this.interval = interval;
		this.scheduler = scheduler;
		this.clock = clock;
	}

	/**
	 * Start the heartbeat for a session.
	 * @param session an open session
	 * @return the heartbeat subscription, already attached to the session
	 */
	public Disposable start(McpSession session) {
		Disposable subscription = Flux.interval(this.interval, this.interval, this.scheduler)
			.map(tick -> new SseEvent(SseEvent.HEARTBEAT, this.clock.instant().toString()))
			.takeWhile(event -> session.isOpen())
			.subscribe(event -> {
				if (!session.send(event)) {
					logger.debug("Heartbeat not delivered to session {}", session.getId());
				}
			}, error -> logger.warn("Heartbeat for session {} failed: {}", session.getId(), error.getMessage()));
		session.attachHeartbeat(subscription);
		logger.debug("Heartbeat every {} started for session {}", this.interval, session.getId());
		return subscription;
	}

	public Duration getInterval() {
		return this.interval;
	}

}
