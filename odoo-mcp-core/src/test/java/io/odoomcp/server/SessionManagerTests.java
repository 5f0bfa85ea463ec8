/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SessionManager} and {@link McpSession}.
 */
class SessionManagerTests {

	private MutableClock clock;

	private SessionManager sessionManager;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
		sessionManager = new SessionManager(clock);
	}

	@Test
	void testTokensAre32LowercaseHexCharsAndUnique() {
		Set<String> ids = new HashSet<>();
		for (int i = 0; i < 100; i++) {
			String id = sessionManager.openSession().getId();
			assertThat(id).matches("[0-9a-f]{32}");
			ids.add(id);
		}

		assertThat(ids).hasSize(100);
		assertThat(sessionManager.activeCount()).isEqualTo(100);
	}

	@Test
	void testTouchUpdatesLastActivity() {
		McpSession session = sessionManager.openSession();
		assertThat(session.getLastActivity()).isEqualTo(session.getCreatedAt());

		clock.advance(Duration.ofMinutes(5));
		sessionManager.touch(session.getId());

		assertThat(session.getLastActivity()).isEqualTo(Instant.parse("2025-01-01T00:05:00Z"));
	}

	@Test
	void testTouchUnknownSessionIsIgnored() {
		sessionManager.touch("does-not-exist");
		sessionManager.touch(null);

		assertThat(sessionManager.activeCount()).isZero();
	}

	@Test
	void testCloseIsIdempotent() {
		McpSession session = sessionManager.openSession();

		sessionManager.close(session.getId());
		sessionManager.close(session.getId());
		sessionManager.close(null);

		assertThat(session.isOpen()).isFalse();
		assertThat(sessionManager.activeCount()).isZero();
		assertThat(sessionManager.find(session.getId())).isEmpty();
	}

	@Test
	void testCloseCompletesEventsAndDisposesHeartbeat() {
		McpSession session = sessionManager.openSession();
		Disposable heartbeat = Flux.never().subscribe();
		session.attachHeartbeat(heartbeat);

		session.send(new SseEvent(SseEvent.READY, "MCP server ready"));
		sessionManager.close(session.getId());

		StepVerifier.create(session.events())
			.expectNext(new SseEvent(SseEvent.READY, "MCP server ready"))
			.verifyComplete();
		assertThat(heartbeat.isDisposed()).isTrue();
	}

	@Test
	void testSendAfterCloseIsRejected() {
		McpSession session = sessionManager.openSession();
		sessionManager.close(session.getId());

		assertThat(session.send(new SseEvent(SseEvent.HEARTBEAT, "now"))).isFalse();
	}

	@Test
	void testHeartbeatAttachedAfterCloseIsDisposed() {
		McpSession session = sessionManager.openSession();
		sessionManager.close(session.getId());

		Disposable heartbeat = Flux.never().subscribe();
		session.attachHeartbeat(heartbeat);

		assertThat(heartbeat.isDisposed()).isTrue();
	}

	@Test
	void testEvictIdleClosesOnlyStaleSessions() {
		McpSession stale = sessionManager.openSession();
		clock.advance(Duration.ofMinutes(20));
		McpSession fresh = sessionManager.openSession();
		clock.advance(Duration.ofMinutes(15));

		int evicted = sessionManager.evictIdle(Duration.ofMinutes(30));

		assertThat(evicted).isEqualTo(1);
		assertThat(stale.isOpen()).isFalse();
		assertThat(fresh.isOpen()).isTrue();
		assertThat(sessionManager.find(fresh.getId())).contains(fresh);
	}

	@Test
	void testCloseAll() {
		McpSession first = sessionManager.openSession();
		McpSession second = sessionManager.openSession();

		sessionManager.closeAll();

		assertThat(first.isOpen()).isFalse();
		assertThat(second.isOpen()).isFalse();
		assertThat(sessionManager.activeCount()).isZero();
	}

	static final class MutableClock extends Clock {

		private Instant now;

		MutableClock(Instant now) {
			this.now = now;
		}

		void advance(Duration duration) {
			this.now = this.now.plus(duration);
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return this.now;
		}

	}

}
