/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.session;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.trellomcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the {@link SessionRegistry} for the lifetime of the process.
 * <p>
 * The manager is opened once by the entry point, before the HTTP server accepts
 * connections, and closed once when the process stops. A failure to start the registry
 * does not propagate: it is logged, the manager reports itself unavailable and the
 * transport answers {@code 503} until the process is restarted.
 *
 * <pre>{@code
 * try (SessionLifecycleManager lifecycle = SessionLifecycleManager.open(registryFactory)) {
 *     lifecycle.registerShutdownHook();
 *     server.start();
 *     server.join();
 * }
 * }</pre>
 */
public final class SessionLifecycleManager implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleManager.class);

	private final SessionRegistry registry;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private volatile Thread shutdownHook;

	private SessionLifecycleManager(SessionRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Creates and starts the session registry.
	 * @param registryFactory creates the registry to manage
	 * @return the manager, unavailable if the registry could not be started
	 */
	public static SessionLifecycleManager open(Supplier<SessionRegistry> registryFactory) {
		Assert.notNull(registryFactory, "registryFactory must not be null");
		SessionRegistry registry = null;
		try {
			registry = registryFactory.get();
			registry.start();
			logger.info("Session subsystem initialized");
			return new SessionLifecycleManager(registry);
		}
		catch (RuntimeException e) {
			logger.error("Session subsystem failed to initialize, MCP endpoint will answer 503", e);
			if (registry != null) {
				registry.close();
			}
			return new SessionLifecycleManager(null);
		}
	}

	public boolean isAvailable() {
		return this.registry != null && !this.closed.get();
	}

	/**
	 * @return the managed registry while the manager is available
	 */
	public Optional<SessionRegistry> registry() {
		return isAvailable() ? Optional.of(this.registry) : Optional.empty();
	}

	/**
	 * Closes the manager when the JVM shuts down, e.g. on {@code SIGTERM}.
	 */
	public synchronized void registerShutdownHook() {
		if (this.shutdownHook == null) {
			this.shutdownHook = new Thread(this::close, "session-lifecycle-shutdown");
			Runtime.getRuntime().addShutdownHook(this.shutdownHook);
		}
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	/**
	 * Releases the session subsystem. Only the first call has an effect.
	 */
	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		if (this.registry != null) {
			logger.info("Releasing session subsystem");
			this.registry.close();
		}
		removeShutdownHook();
	}

	private synchronized void removeShutdownHook() {
		Thread hook = this.shutdownHook;
		if (hook == null || Thread.currentThread() == hook) {
			return;
		}
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch (IllegalStateException e) {
			logger.debug("JVM shutdown in progress, keeping shutdown hook: {}", e.getMessage());
		}
	}

}
