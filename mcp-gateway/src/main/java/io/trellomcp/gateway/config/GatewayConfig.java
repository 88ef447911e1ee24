/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.config;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.trellomcp.gateway.server.auth.CredentialStore;
import io.trellomcp.gateway.server.transport.HeaderInjectionPolicy;
import io.trellomcp.gateway.util.Assert;
import io.trellomcp.gateway.util.Utils;

/**
 * Immutable gateway settings, read once at startup.
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code MCP_API_KEYS_READ_ONLY}</td><td>empty</td></tr>
 * <tr><td>{@code MCP_API_KEYS_READ_WRITE}</td><td>empty</td></tr>
 * <tr><td>{@code MCP_API_KEYS}</td><td>empty</td></tr>
 * <tr><td>{@code MCP_SERVER_HOST}</td><td>{@code 0.0.0.0}</td></tr>
 * <tr><td>{@code MCP_SERVER_PORT}</td><td>{@code 8000}</td></tr>
 * <tr><td>{@code USE_CLAUDE_APP}</td><td>{@code true}</td></tr>
 * <tr><td>{@code MCP_ENDPOINT}</td><td>{@code /mcp}</td></tr>
 * <tr><td>{@code MCP_HEALTH_PATHS}</td><td>{@code /health,/healthz}</td></tr>
 * <tr><td>{@code MCP_STREAM_HEADER_POLICY}</td><td>{@code permissive}</td></tr>
 * <tr><td>{@code MCP_KEEP_ALIVE_SECONDS}</td><td>{@code 30}</td></tr>
 * <tr><td>{@code MCP_SESSION_TIMEOUT_MINUTES}</td><td>{@code 30}</td></tr>
 * </table>
 */
public final class GatewayConfig {

	public static final String DEFAULT_HOST = "0.0.0.0";

	public static final int DEFAULT_PORT = 8000;

	public static final String DEFAULT_ENDPOINT = "/mcp";

	public static final List<String> DEFAULT_HEALTH_PATHS = List.of("/health", "/healthz");

	private final String host;

	private final int port;

	private final boolean stdio;

	private final String endpoint;

	private final List<String> healthPaths;

	private final HeaderInjectionPolicy headerPolicy;

	private final Duration keepAliveInterval;

	private final Duration sessionTimeout;

	private final String readOnlyKeys;

	private final String readWriteKeys;

	private final String legacyKeys;

	private GatewayConfig(Builder builder) {
		this.host = builder.host;
		this.port = builder.port;
		this.stdio = builder.stdio;
		this.endpoint = builder.endpoint;
		this.healthPaths = List.copyOf(builder.healthPaths);
		this.headerPolicy = builder.headerPolicy;
		this.keepAliveInterval = builder.keepAliveInterval;
		this.sessionTimeout = builder.sessionTimeout;
		this.readOnlyKeys = builder.readOnlyKeys;
		this.readWriteKeys = builder.readWriteKeys;
		this.legacyKeys = builder.legacyKeys;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Reads the configuration from the given variables.
	 * @param env the variables, typically {@link System#getenv()}
	 * @return the configuration
	 * @throws IllegalArgumentException if a value cannot be parsed
	 */
	public static GatewayConfig fromEnvironment(Map<String, String> env) {
		Assert.notNull(env, "env must not be null");
		Builder builder = builder().readOnlyKeys(env.get("MCP_API_KEYS_READ_ONLY"))
			.readWriteKeys(env.get("MCP_API_KEYS_READ_WRITE"))
			.legacyKeys(env.get("MCP_API_KEYS"))
			.stdio(parseBoolean(env.get("USE_CLAUDE_APP"), true))
			.headerPolicy(HeaderInjectionPolicy.parse(env.get("MCP_STREAM_HEADER_POLICY")));
		if (Utils.hasText(env.get("MCP_SERVER_HOST"))) {
			builder.host(env.get("MCP_SERVER_HOST").trim());
		}
		if (Utils.hasText(env.get("MCP_SERVER_PORT"))) {
			builder.port(parseInt("MCP_SERVER_PORT", env.get("MCP_SERVER_PORT")));
		}
		if (Utils.hasText(env.get("MCP_ENDPOINT"))) {
			builder.endpoint(env.get("MCP_ENDPOINT").trim());
		}
		if (Utils.hasText(env.get("MCP_HEALTH_PATHS"))) {
			builder.healthPaths(List.copyOf(Utils.commaDelimitedListToSet(env.get("MCP_HEALTH_PATHS"))));
		}
		if (Utils.hasText(env.get("MCP_KEEP_ALIVE_SECONDS"))) {
			builder.keepAliveInterval(
					Duration.ofSeconds(parseInt("MCP_KEEP_ALIVE_SECONDS", env.get("MCP_KEEP_ALIVE_SECONDS"))));
		}
		if (Utils.hasText(env.get("MCP_SESSION_TIMEOUT_MINUTES"))) {
			builder.sessionTimeout(Duration
				.ofMinutes(parseInt("MCP_SESSION_TIMEOUT_MINUTES", env.get("MCP_SESSION_TIMEOUT_MINUTES"))));
		}
		return builder.build();
	}

	private static int parseInt(String name, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(name + " must be an integer but was '" + value + "'", e);
		}
	}

	static boolean parseBoolean(String value, boolean defaultValue) {
		if (!Utils.hasText(value)) {
			return defaultValue;
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
	}

	/**
	 * Builds the credential store from the configured key lists.
	 * @return a new store
	 */
	public CredentialStore credentialStore() {
		return CredentialStore.fromLists(this.readOnlyKeys, this.readWriteKeys, this.legacyKeys);
	}

	public String getHost() {
		return this.host;
	}

	public int getPort() {
		return this.port;
	}

	public boolean isStdio() {
		return this.stdio;
	}

	public String getEndpoint() {
		return this.endpoint;
	}

	public List<String> getHealthPaths() {
		return this.healthPaths;
	}

	public HeaderInjectionPolicy getHeaderPolicy() {
		return this.headerPolicy;
	}

	public Duration getKeepAliveInterval() {
		return this.keepAliveInterval;
	}

	public Duration getSessionTimeout() {
		return this.sessionTimeout;
	}

	@Override
	public String toString() {
		return "GatewayConfig[host=" + this.host + ", port=" + this.port + ", stdio=" + this.stdio + ", endpoint="
				+ this.endpoint + ", healthPaths=" + this.healthPaths + ", headerPolicy=" + this.headerPolicy
				+ ", keepAlive=" + this.keepAliveInterval + ", sessionTimeout=" + this.sessionTimeout + "]";
	}

	public static final class Builder {

		private String host = DEFAULT_HOST;

		private int port = DEFAULT_PORT;

		private boolean stdio = true;

		private String endpoint = DEFAULT_ENDPOINT;

		private List<String> healthPaths = DEFAULT_HEALTH_PATHS;

		private HeaderInjectionPolicy headerPolicy = HeaderInjectionPolicy.PERMISSIVE;

		private Duration keepAliveInterval = Duration.ofSeconds(30);

		private Duration sessionTimeout = Duration.ofMinutes(30);

		private String readOnlyKeys;

		private String readWriteKeys;

		private String legacyKeys;

		private Builder() {
		}

		public Builder host(String host) {
			Assert.hasText(host, "host must not be empty");
			this.host = host;
			return this;
		}

		/**
		 * @param port the port to bind, {@code 0} picks an ephemeral port
		 */
		public Builder port(int port) {
			Assert.isTrue(port >= 0 && port <= 65535, "port must be between 0 and 65535 but was " + port);
			this.port = port;
			return this;
		}

		public Builder stdio(boolean stdio) {
			this.stdio = stdio;
			return this;
		}

		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "endpoint must not be empty");
			Assert.isTrue(endpoint.startsWith("/"), "endpoint must start with '/'");
			this.endpoint = endpoint;
			return this;
		}

		public Builder healthPaths(List<String> healthPaths) {
			Assert.notNull(healthPaths, "healthPaths must not be null");
			healthPaths.forEach(p -> Assert.isTrue(p.startsWith("/"), "health path must start with '/': " + p));
			this.healthPaths = healthPaths;
			return this;
		}

		public Builder headerPolicy(HeaderInjectionPolicy headerPolicy) {
			Assert.notNull(headerPolicy, "headerPolicy must not be null");
			this.headerPolicy = headerPolicy;
			return this;
		}

		public Builder keepAliveInterval(Duration keepAliveInterval) {
			Assert.notNull(keepAliveInterval, "keepAliveInterval must not be null");
			Assert.isTrue(!keepAliveInterval.isNegative(), "keepAliveInterval must not be negative");
			this.keepAliveInterval = keepAliveInterval;
			return this;
		}

		public Builder sessionTimeout(Duration sessionTimeout) {
			Assert.notNull(sessionTimeout, "sessionTimeout must not be null");
			Assert.isTrue(!sessionTimeout.isNegative() && !sessionTimeout.isZero(), "sessionTimeout must be positive");
			this.sessionTimeout = sessionTimeout;
			return this;
		}

		public Builder readOnlyKeys(String readOnlyKeys) {
			this.readOnlyKeys = readOnlyKeys;
			return this;
		}

		public Builder readWriteKeys(String readWriteKeys) {
			this.readWriteKeys = readWriteKeys;
			return this;
		}

		public Builder legacyKeys(String legacyKeys) {
			this.legacyKeys = legacyKeys;
			return this;
		}

		public GatewayConfig build() {
			return new GatewayConfig(this);
		}

	}

}
