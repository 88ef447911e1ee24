/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.type.CollectionType;
import io.trellomcp.gateway.util.Assert;
import io.trellomcp.trello.client.TrelloClient;
import reactor.core.publisher.Mono;

/**
 * Base class of the Trello services, mapping raw JSON responses to model records.
 */
public abstract class AbstractTrelloService {

	protected final TrelloClient client;

	protected AbstractTrelloService(TrelloClient client) {
		Assert.notNull(client, "client must not be null");
		this.client = client;
	}

	protected <T> Mono<T> as(Mono<JsonNode> response, Class<T> type) {
		return response.map(node -> this.client.getObjectMapper().convertValue(node, type));
	}

	protected <T> Mono<List<T>> asList(Mono<JsonNode> response, Class<T> elementType) {
		return response.map(node -> {
			CollectionType listType = this.client.getObjectMapper()
				.getTypeFactory()
				.constructCollectionType(List.class, elementType);
			List<T> result = this.client.getObjectMapper().convertValue(node, listType);
			return result != null ? result : List.<T>of();
		});
	}

	protected static String requireId(String value, String name) {
		Assert.hasText(value, name + " must not be empty");
		return value;
	}

}
