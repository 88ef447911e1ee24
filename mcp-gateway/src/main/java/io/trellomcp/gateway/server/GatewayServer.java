/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server;

import java.util.EnumSet;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.config.GatewayConfig;
import io.trellomcp.gateway.server.auth.AuthenticationFilter;
import io.trellomcp.gateway.server.auth.CredentialStore;
import io.trellomcp.gateway.server.session.SessionLifecycleManager;
import io.trellomcp.gateway.server.transport.CorsFilter;
import io.trellomcp.gateway.server.transport.HealthServlet;
import io.trellomcp.gateway.server.transport.StreamIntegrityFilter;
import io.trellomcp.gateway.server.transport.StreamableHttpServerTransportProvider;
import io.trellomcp.gateway.util.Assert;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.Filter;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Jetty server hosting the MCP endpoint and the health endpoints.
 * <p>
 * Request pipeline, in order: {@link CorsFilter}, {@link AuthenticationFilter},
 * {@link StreamIntegrityFilter} (MCP endpoint only), then the
 * {@link StreamableHttpServerTransportProvider} or the {@link HealthServlet}.
 */
public class GatewayServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(GatewayServer.class);

	private static final EnumSet<DispatcherType> DISPATCHES = EnumSet.of(DispatcherType.REQUEST,
			DispatcherType.ASYNC);

	private final Server server;

	private final GatewayConfig config;

	public GatewayServer(GatewayConfig config, CredentialStore credentialStore, McpToolDispatcher dispatcher,
			SessionLifecycleManager lifecycleManager, ObjectMapper objectMapper) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(credentialStore, "credentialStore must not be null");
		Assert.notNull(dispatcher, "dispatcher must not be null");
		Assert.notNull(lifecycleManager, "lifecycleManager must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.config = config;

		this.server = new Server();
		this.server.setStopAtShutdown(true);
		ServerConnector connector = new ServerConnector(this.server);
		connector.setHost(config.getHost());
		connector.setPort(config.getPort());
		this.server.addConnector(connector);

		ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
		context.setContextPath("/");
		this.server.setHandler(context);

		addFilter(context, new CorsFilter(), "/*");
		addFilter(context, new AuthenticationFilter(credentialStore, config.getHealthPaths(), objectMapper), "/*");
		addFilter(context, new StreamIntegrityFilter(config.getHeaderPolicy()), config.getEndpoint());

		StreamableHttpServerTransportProvider transport = StreamableHttpServerTransportProvider.builder()
			.objectMapper(objectMapper)
			.dispatcher(dispatcher)
			.lifecycleManager(lifecycleManager)
			.build();
		ServletHolder transportHolder = new ServletHolder("mcp", transport);
		transportHolder.setAsyncSupported(true);
		context.addServlet(transportHolder, config.getEndpoint());

		ServletHolder healthHolder = new ServletHolder("health", new HealthServlet(objectMapper));
		for (String path : config.getHealthPaths()) {
			context.addServlet(healthHolder, path.endsWith("/") ? path + "*" : path + "/*");
		}
	}

	private static void addFilter(ServletContextHandler context, Filter filter, String pathSpec) {
		FilterHolder holder = new FilterHolder(filter);
		holder.setAsyncSupported(true);
		context.addFilter(holder, pathSpec, DISPATCHES);
	}

	/**
	 * Starts accepting connections.
	 * @throws IllegalStateException if the server cannot be started
	 */
	public void start() {
		try {
			this.server.start();
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to start HTTP server on " + this.config.getHost() + ":"
					+ this.config.getPort(), e);
		}
		logger.info("MCP gateway listening on http://{}:{}{}", this.config.getHost(), getPort(),
				this.config.getEndpoint());
	}

	/**
	 * @return the bound port, useful when configured with port {@code 0}
	 */
	public int getPort() {
		return ((ServerConnector) this.server.getConnectors()[0]).getLocalPort();
	}

	public void join() throws InterruptedException {
		this.server.join();
	}

	@Override
	public void close() throws Exception {
		if (this.server.isStarted()) {
			logger.info("Stopping HTTP server");
			this.server.stop();
		}
	}

}
