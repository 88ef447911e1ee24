/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.trellomcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * In-memory registry of active sessions.
 * <p>
 * {@link #start()} schedules the idle-expiry sweeper and, when a keep-alive interval is
 * configured, the periodic keep-alive writes on every open stream. {@link #close()}
 * cancels both tasks and closes every session. The registry is the only long-lived
 * shared mutable state of the gateway; it is owned by the
 * {@link SessionLifecycleManager}.
 */
public class SessionRegistry implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

	private final Map<String, McpSession> sessions = new ConcurrentHashMap<>();

	private final Duration sessionTimeout;

	private final Duration keepAliveInterval;

	private final Duration sweepInterval;

	private final Supplier<String> sessionIdGenerator;

	private final Clock clock;

	private final Disposable.Composite tasks = Disposables.composite();

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private SessionRegistry(Builder builder) {
		this.sessionTimeout = builder.sessionTimeout;
		this.keepAliveInterval = builder.keepAliveInterval;
		this.sweepInterval = builder.sweepInterval;
		this.sessionIdGenerator = builder.sessionIdGenerator;
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Schedules the background tasks. Must be called once before the registry is used.
	 * @throws IllegalStateException if the registry was already started or closed
	 */
	public void start() {
		if (this.closed.get()) {
			throw new IllegalStateException("Session registry is closed");
		}
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Session registry already started");
		}
		// Both ticks write to client streams, which may block.
		this.tasks.add(Flux.interval(this.sweepInterval, this.sweepInterval, Schedulers.boundedElastic())
			.subscribe(tick -> evictExpired(), e -> logger.error("Session sweeper stopped", e)));
		if (!this.keepAliveInterval.isZero() && !this.keepAliveInterval.isNegative()) {
			this.tasks.add(Flux.interval(this.keepAliveInterval, this.keepAliveInterval, Schedulers.boundedElastic())
				.subscribe(tick -> sendKeepAlives(), e -> logger.error("Keep-alive scheduler stopped", e)));
		}
		logger.info("Session registry started (timeout {}, keep-alive {})", this.sessionTimeout,
				this.keepAliveInterval);
	}

	public McpSession create() {
		assertOpen();
		String id = this.sessionIdGenerator.get();
		McpSession session = new McpSession(id, this.clock.instant());
		if (this.sessions.putIfAbsent(id, session) != null) {
			throw new IllegalStateException("Duplicate session id generated: " + id);
		}
		logger.debug("Created session {}", id);
		return session;
	}

	/**
	 * Looks up a session and marks it as accessed.
	 * @param id the session id
	 * @return the session, or empty if unknown
	 */
	public Optional<McpSession> find(String id) {
		if (id == null) {
			return Optional.empty();
		}
		McpSession session = this.sessions.get(id);
		if (session != null) {
			session.touch(this.clock.instant());
		}
		return Optional.ofNullable(session);
	}

	/**
	 * Removes and closes a session.
	 * @param id the session id
	 * @return {@code true} if the session existed
	 */
	public boolean remove(String id) {
		McpSession session = id != null ? this.sessions.remove(id) : null;
		if (session == null) {
			return false;
		}
		session.close();
		logger.debug("Removed session {}", id);
		return true;
	}

	/**
	 * Closes and removes every session idle for longer than the session timeout.
	 * @return the number of evicted sessions
	 */
	public int evictExpired() {
		Instant now = this.clock.instant();
		int evicted = 0;
		Iterator<Map.Entry<String, McpSession>> it = this.sessions.entrySet().iterator();
		while (it.hasNext()) {
			Map.Entry<String, McpSession> entry = it.next();
			McpSession session = entry.getValue();
			// streams being written count as activity
			if (session.getStreams().isEmpty() && session.isExpired(this.sessionTimeout, now)) {
				it.remove();
				session.close();
				evicted++;
			}
		}
		if (evicted > 0) {
			logger.info("Evicted {} idle sessions, {} remain", evicted, this.sessions.size());
		}
		return evicted;
	}

	/**
	 * Writes a keep-alive on every open stream and detaches streams that are no longer
	 * writable.
	 */
	public void sendKeepAlives() {
		for (McpSession session : this.sessions.values()) {
			for (McpSessionStream stream : session.getStreams()) {
				if (!stream.sendKeepAlive()) {
					logger.debug("Dropping dead stream of session {}", session.getId());
					session.removeStream(stream);
					stream.close();
				}
			}
		}
	}

	public int size() {
		return this.sessions.size();
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		this.tasks.dispose();
		int count = this.sessions.size();
		this.sessions.values().forEach(McpSession::close);
		this.sessions.clear();
		logger.info("Session registry closed, {} sessions released", count);
	}

	private void assertOpen() {
		if (this.closed.get()) {
			throw new IllegalStateException("Session registry is closed");
		}
	}

	public static class Builder {

		private Duration sessionTimeout = Duration.ofMinutes(30);

		private Duration keepAliveInterval = Duration.ofSeconds(30);

		private Duration sweepInterval = Duration.ofSeconds(30);

		private Supplier<String> sessionIdGenerator = () -> UUID.randomUUID().toString();

		private Clock clock = Clock.systemUTC();

		public Builder sessionTimeout(Duration sessionTimeout) {
			Assert.notNull(sessionTimeout, "sessionTimeout must not be null");
			Assert.isTrue(!sessionTimeout.isNegative() && !sessionTimeout.isZero(),
					"sessionTimeout must be positive");
			this.sessionTimeout = sessionTimeout;
			return this;
		}

		/**
		 * @param keepAliveInterval interval between keep-alive writes, zero disables them
		 */
		public Builder keepAliveInterval(Duration keepAliveInterval) {
			Assert.notNull(keepAliveInterval, "keepAliveInterval must not be null");
			Assert.isTrue(!keepAliveInterval.isNegative(), "keepAliveInterval must not be negative");
			this.keepAliveInterval = keepAliveInterval;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			Assert.notNull(sweepInterval, "sweepInterval must not be null");
			Assert.isTrue(!sweepInterval.isNegative() && !sweepInterval.isZero(), "sweepInterval must be positive");
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder sessionIdGenerator(Supplier<String> sessionIdGenerator) {
			Assert.notNull(sessionIdGenerator, "sessionIdGenerator must not be null");
			this.sessionIdGenerator = sessionIdGenerator;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public SessionRegistry build() {
			return new SessionRegistry(this);
		}

	}

}
