/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.session;

/**
 * An open server-to-client stream attached to a {@link McpSession}.
 */
public interface McpSessionStream {

	/**
	 * Writes a keep-alive comment so intermediaries do not consider the stream idle.
	 * @return {@code false} if the stream is no longer writable
	 */
	boolean sendKeepAlive();

	/**
	 * Completes the stream. Calling this more than once has no effect.
	 */
	void close();

}
