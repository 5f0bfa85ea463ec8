/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.server;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.odoomcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Tracks the open SSE sessions. Safe for concurrent use from container threads, the
 * heartbeat scheduler and the eviction task.
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	private static final int TOKEN_BYTES = 16;

	private final ConcurrentHashMap<String, McpSession> sessions = new ConcurrentHashMap<>();

	private final SecureRandom random = new SecureRandom();

	private final Clock clock;

	public SessionManager() {
		this(Clock.systemUTC());
	}

	public SessionManager(Clock clock) {
		Assert.notNull(clock, "Clock must not be null");
		this.clock = clock;
	}

	/**
	 * Registers a new open session under an unguessable 128-bit token rendered as 32
	 * lowercase hex characters.
	 * @return the new session
	 */
	public McpSession openSession() {
		McpSession session;
		do {
			session = new McpSession(newToken(), this.clock);
		}
		while (this.sessions.putIfAbsent(session.getId(), session) != null);
		logger.info("Opened session {} ({} active)", session.getId(), this.sessions.size());
		return session;
	}

	private String newToken() {
		byte[] bytes = new byte[TOKEN_BYTES];
		this.random.nextBytes(bytes);
		return HexFormat.of().formatHex(bytes);
	}

	public void touch(@Nullable String sessionId) {
		McpSession session = (sessionId != null) ? this.sessions.get(sessionId) : null;
		if (session == null || !session.isOpen()) {
			logger.debug("Ignoring activity for unknown session {}", sessionId);
			return;
		}
		session.touch();
	}

	public Optional<McpSession> find(@Nullable String sessionId) {
		if (sessionId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(this.sessions.get(sessionId)).filter(McpSession::isOpen);
	}

	/**
	 * Closes and forgets a session. Calling it again, or for an unknown id, does nothing.
	 * @param sessionId the session to close
	 */
	public void close(@Nullable String sessionId) {
		if (sessionId == null) {
			return;
		}
		McpSession session = this.sessions.remove(sessionId);
		if (session != null && session.close()) {
			logger.info("Closed session {} ({} active)", sessionId, this.sessions.size());
		}
	}

	public int activeCount() {
		return this.sessions.size();
	}

	/**
	 * Closes every session whose last activity is older than {@code idleTimeout}.
	 * @param idleTimeout the maximum idle period
	 * @return the number of sessions closed
	 */
	public int evictIdle(Duration idleTimeout) {
		Assert.notNull(idleTimeout, "Idle timeout must not be null");
		Instant threshold = this.clock.instant().minus(idleTimeout);
		List<String> idle = this.sessions.values()
			.stream()
			.filter(session -> session.getLastActivity().isBefore(threshold))
			.map(McpSession::getId)
			.toList();
		idle.forEach(id -> {
			logger.info("Evicting idle session {}", id);
			close(id);
		});
		return idle.size();
	}

	public void closeAll() {
		List<String> ids = List.copyOf(this.sessions.keySet());
		ids.forEach(this::close);
		if (!ids.isEmpty()) {
			logger.info("Closed {} sessions", ids.size());
		}
	}

}
