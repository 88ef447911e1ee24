/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionRegistryTests {

	private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

	private SessionRegistry registry;

	@AfterEach
	void tearDown() {
		if (this.registry != null) {
			this.registry.close();
		}
	}

	@Test
	void createsAndFindsSessions() {
		this.registry = registry(Duration.ofMinutes(5));

		McpSession session = this.registry.create();

		assertThat(this.registry.find(session.getId())).containsSame(session);
		assertThat(this.registry.find("unknown")).isEmpty();
		assertThat(this.registry.find(null)).isEmpty();
		assertThat(this.registry.size()).isEqualTo(1);
	}

	@Test
	void removeClosesSession() {
		this.registry = registry(Duration.ofMinutes(5));
		McpSession session = this.registry.create();
		McpSessionStream stream = mock(McpSessionStream.class);
		session.addStream(stream);

		assertThat(this.registry.remove(session.getId())).isTrue();
		assertThat(this.registry.remove(session.getId())).isFalse();

		assertThat(session.isClosed()).isTrue();
		verify(stream).close();
	}

	@Test
	void evictsOnlyIdleSessionsWithoutStreams() {
		this.registry = registry(Duration.ofMinutes(5));
		McpSession idle = this.registry.create();
		McpSession streaming = this.registry.create();
		McpSession active = this.registry.create();
		streaming.addStream(mock(McpSessionStream.class));

		this.clock.advance(Duration.ofMinutes(4));
		this.registry.find(active.getId());
		this.clock.advance(Duration.ofMinutes(2));

		assertThat(this.registry.evictExpired()).isEqualTo(1);
		assertThat(idle.isClosed()).isTrue();
		assertThat(this.registry.find(idle.getId())).isEmpty();
		assertThat(this.registry.find(streaming.getId())).isPresent();
		assertThat(this.registry.find(active.getId())).isPresent();
	}

	@Test
	void keepAliveDropsDeadStreams() {
		this.registry = registry(Duration.ofMinutes(5));
		McpSession session = this.registry.create();
		McpSessionStream alive = mock(McpSessionStream.class);
		McpSessionStream dead = mock(McpSessionStream.class);
		when(alive.sendKeepAlive()).thenReturn(true);
		when(dead.sendKeepAlive()).thenReturn(false);
		session.addStream(alive);
		session.addStream(dead);

		this.registry.sendKeepAlives();

		assertThat(session.getStreams()).containsExactly(alive);
		verify(dead).close();
	}

	@Test
	void scheduledKeepAlivesReachOpenStreams() {
		this.registry = SessionRegistry.builder().keepAliveInterval(Duration.ofMillis(50)).build();
		this.registry.start();
		AtomicInteger keepAlives = new AtomicInteger();
		McpSessionStream stream = mock(McpSessionStream.class);
		when(stream.sendKeepAlive()).thenAnswer(invocation -> keepAlives.incrementAndGet() > 0);
		this.registry.create().addStream(stream);

		await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(keepAlives).hasValueGreaterThan(1));
	}

	@Test
	void scheduledKeepAlivesRunOffTheParallelScheduler() {
		this.registry = SessionRegistry.builder().keepAliveInterval(Duration.ofMillis(50)).build();
		this.registry.start();
		AtomicReference<String> threadName = new AtomicReference<>();
		McpSessionStream stream = mock(McpSessionStream.class);
		when(stream.sendKeepAlive()).thenAnswer(invocation -> {
			threadName.compareAndSet(null, Thread.currentThread().getName());
			return true;
		});
		this.registry.create().addStream(stream);

		await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(threadName.get()).isNotNull());
		assertThat(threadName.get()).contains("boundedElastic").doesNotContain("parallel");
	}

	@Test
	void startTwiceOrAfterCloseFails() {
		this.registry = registry(Duration.ofMinutes(5));
		this.registry.start();

		assertThatThrownBy(() -> this.registry.start()).isInstanceOf(IllegalStateException.class);

		this.registry.close();
		assertThatThrownBy(() -> this.registry.start()).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> this.registry.create()).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void closeReleasesAllSessionsOnce() {
		this.registry = registry(Duration.ofMinutes(5));
		McpSession first = this.registry.create();
		McpSession second = this.registry.create();

		this.registry.close();
		this.registry.close();

		assertThat(this.registry.isClosed()).isTrue();
		assertThat(this.registry.size()).isZero();
		assertThat(first.isClosed()).isTrue();
		assertThat(second.isClosed()).isTrue();
	}

	@Test
	void closedSessionRejectsNewStreams() {
		McpSession session = new McpSession("s-1", this.clock.instant());
		session.close();
		McpSessionStream stream = mock(McpSessionStream.class);

		assertThat(session.addStream(stream)).isFalse();
		verify(stream).close();
	}

	private SessionRegistry registry(Duration timeout) {
		return SessionRegistry.builder().sessionTimeout(timeout).keepAliveInterval(Duration.ZERO).clock(this.clock)
			.build();
	}

	static final class MutableClock extends Clock {

		private volatile Instant now;

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
