/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.session;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.trellomcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bookkeeping for one logical MCP connection identified by {@code Mcp-Session-Id}.
 * <p>
 * The gateway does not keep protocol state per session beyond the negotiated protocol
 * version; roles are bound per request and never stored here.
 */
public class McpSession {

	private static final Logger logger = LoggerFactory.getLogger(McpSession.class);

	private final String id;

	private volatile Instant lastAccessedAt;

	private volatile String protocolVersion;

	private final Set<McpSessionStream> streams = ConcurrentHashMap.newKeySet();

	private final AtomicBoolean closed = new AtomicBoolean(false);

	public McpSession(String id, Instant createdAt) {
		Assert.hasText(id, "Session id must not be empty");
		Assert.notNull(createdAt, "createdAt must not be null");
		this.id = id;
		this.lastAccessedAt = createdAt;
	}

	public String getId() {
		return this.id;
	}

	public Instant getLastAccessedAt() {
		return this.lastAccessedAt;
	}

	public String getProtocolVersion() {
		return this.protocolVersion;
	}

	public void setProtocolVersion(String protocolVersion) {
		this.protocolVersion = protocolVersion;
	}

	public void touch(Instant now) {
		this.lastAccessedAt = now;
	}

	public boolean isExpired(Duration timeout, Instant now) {
		return Duration.between(this.lastAccessedAt, now).compareTo(timeout) > 0;
	}

	/**
	 * Attaches a stream to this session.
	 * @param stream the stream
	 * @return {@code false} if the session is already closed; the stream is closed in
	 * that case
	 */
	public boolean addStream(McpSessionStream stream) {
		if (this.closed.get()) {
			stream.close();
			return false;
		}
		this.streams.add(stream);
		return true;
	}

	public void removeStream(McpSessionStream stream) {
		this.streams.remove(stream);
	}

	public List<McpSessionStream> getStreams() {
		return List.copyOf(this.streams);
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	/**
	 * Closes every attached stream. Only the first call has an effect.
	 */
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		logger.debug("Closing session {} with {} open streams", this.id, this.streams.size());
		for (McpSessionStream stream : this.streams) {
			stream.close();
		}
		this.streams.clear();
	}

}
