/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.client;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.trellomcp.gateway.util.Assert;
import io.trellomcp.trello.TrelloConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Non-blocking client of the Trello REST API built on the JDK {@link HttpClient}.
 * <p>
 * The API key and token are sent as query parameters on every request. Request bodies
 * are serialized as JSON. Responses with a status outside {@code 2xx} fail with a
 * {@link TrelloApiException}; nothing is retried.
 */
public class TrelloClient {

	private static final Logger logger = LoggerFactory.getLogger(TrelloClient.class);

	private static final String APPLICATION_JSON = "application/json";

	private final TrelloConfig config;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	public TrelloClient(TrelloConfig config, ObjectMapper objectMapper) {
		this(config, HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build(), objectMapper);
	}

	public TrelloClient(TrelloConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.config = config;
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	public Mono<JsonNode> get(String path) {
		return get(path, Map.of());
	}

	public Mono<JsonNode> get(String path, Map<String, ?> params) {
		return send("GET", path, params, null);
	}

	public Mono<JsonNode> post(String path, Object body) {
		return send("POST", path, Map.of(), body);
	}

	public Mono<JsonNode> put(String path, Object body) {
		return send("PUT", path, Map.of(), body);
	}

	public Mono<JsonNode> put(String path, Map<String, ?> params, Object body) {
		return send("PUT", path, params, body);
	}

	public Mono<JsonNode> delete(String path) {
		return send("DELETE", path, Map.of(), null);
	}

	private Mono<JsonNode> send(String method, String path, Map<String, ?> params, Object body) {
		return Mono.defer(() -> {
			HttpRequest request = buildRequest(method, path, params, body);
			logger.debug("Trello {} {}", method, path);
			return Mono.fromFuture(() -> this.httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
				.onErrorMap(e -> !(e instanceof TrelloApiException), e -> new TrelloApiException(method, path, e))
				.map(response -> handleResponse(method, path, response));
		});
	}

	private HttpRequest buildRequest(String method, String path, Map<String, ?> params, Object body) {
		Map<String, Object> query = new LinkedHashMap<>();
		params.forEach((name, value) -> {
			if (value != null) {
				query.put(name, value);
			}
		});
		query.put("key", this.config.apiKey());
		query.put("token", this.config.token());

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(this.config.baseUrl() + path + "?" + encode(query)))
			.timeout(this.config.requestTimeout())
			.header("Accept", APPLICATION_JSON);
		if (body != null) {
			String json;
			try {
				json = this.objectMapper.writeValueAsString(body);
			}
			catch (JsonProcessingException e) {
				throw new IllegalArgumentException("Failed to serialize request body for " + method + " " + path, e);
			}
			builder.header("Content-Type", APPLICATION_JSON)
				.method(method, HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
		}
		else {
			builder.method(method, HttpRequest.BodyPublishers.noBody());
		}
		return builder.build();
	}

	private JsonNode handleResponse(String method, String path, HttpResponse<String> response) {
		int status = response.statusCode();
		if (status < 200 || status >= 300) {
			logger.error("Trello {} {} returned status {}", method, path, status);
			throw new TrelloApiException(method, path, status, response.body());
		}
		String body = response.body();
		if (body == null || body.isBlank()) {
			return NullNode.getInstance();
		}
		try {
			return this.objectMapper.readTree(body);
		}
		catch (IOException e) {
			throw new TrelloApiException(method, path, e);
		}
	}

	private static String encode(Map<String, Object> query) {
		return query.entrySet()
			.stream()
			.map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
					+ URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
			.collect(Collectors.joining("&"));
	}

}
