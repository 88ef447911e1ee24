/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello;

import java.time.Duration;
import java.util.Map;

import io.trellomcp.gateway.util.Assert;
import io.trellomcp.gateway.util.Utils;

/**
 * Credentials and endpoint of the Trello REST API.
 *
 * @param apiKey the Trello API key
 * @param token the Trello user token
 * @param baseUrl the API base URL, without trailing slash
 * @param requestTimeout timeout of a single Trello request
 */
public record TrelloConfig(String apiKey, String token, String baseUrl, Duration requestTimeout) {

	public static final String DEFAULT_BASE_URL = "https://api.trello.com/1";

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public TrelloConfig {
		Assert.hasText(apiKey, "Trello API key must not be empty");
		Assert.hasText(token, "Trello token must not be empty");
		Assert.hasText(baseUrl, "Trello base URL must not be empty");
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
	}

	public TrelloConfig(String apiKey, String token) {
		this(apiKey, token, DEFAULT_BASE_URL, DEFAULT_REQUEST_TIMEOUT);
	}

	/**
	 * Reads {@code TRELLO_API_KEY}, {@code TRELLO_TOKEN}, {@code TRELLO_API_URL} and
	 * {@code TRELLO_TIMEOUT_SECONDS}.
	 * @param env the environment variables
	 * @return the configuration
	 * @throws IllegalStateException if the credentials are missing
	 */
	public static TrelloConfig fromEnvironment(Map<String, String> env) {
		String apiKey = env.get("TRELLO_API_KEY");
		String token = env.get("TRELLO_TOKEN");
		if (!Utils.hasText(apiKey) || !Utils.hasText(token)) {
			throw new IllegalStateException("TRELLO_API_KEY and TRELLO_TOKEN must be set");
		}
		String baseUrl = Utils.hasText(env.get("TRELLO_API_URL")) ? env.get("TRELLO_API_URL").trim()
				: DEFAULT_BASE_URL;
		Duration timeout = DEFAULT_REQUEST_TIMEOUT;
		String timeoutSeconds = env.get("TRELLO_TIMEOUT_SECONDS");
		if (Utils.hasText(timeoutSeconds)) {
			try {
				timeout = Duration.ofSeconds(Long.parseLong(timeoutSeconds.trim()));
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException(
						"TRELLO_TIMEOUT_SECONDS must be an integer but was '" + timeoutSeconds + "'", e);
			}
		}
		return new TrelloConfig(apiKey.trim(), token.trim(), baseUrl, timeout);
	}

	@Override
	public String toString() {
		return "TrelloConfig[baseUrl=" + this.baseUrl + ", requestTimeout=" + this.requestTimeout + "]";
	}

}
