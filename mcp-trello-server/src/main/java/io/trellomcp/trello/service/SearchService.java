/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trellomcp.gateway.util.Assert;
import io.trellomcp.trello.client.TrelloClient;
import reactor.core.publisher.Mono;

/**
 * Full text search over cards and boards.
 */
public class SearchService extends AbstractTrelloService {

	static final int RESULT_LIMIT = 20;

	public SearchService(TrelloClient client) {
		super(client);
	}

	/**
	 * Searches cards and boards, matching partial words.
	 * @param query the search terms
	 * @return an object with {@code cards} and {@code boards} arrays
	 */
	public Mono<JsonNode> search(String query) {
		Assert.hasText(query, "query must not be empty");
		Map<String, Object> params = new LinkedHashMap<>();
		params.put("query", query);
		params.put("modelTypes", "cards,boards");
		params.put("partial", "true");
		params.put("cards_limit", RESULT_LIMIT);
		params.put("boards_limit", RESULT_LIMIT);
		return this.client.get("/search", params).map(this::cardsAndBoards);
	}

	private JsonNode cardsAndBoards(JsonNode response) {
		ObjectNode result = this.client.getObjectMapper().createObjectNode();
		result.set("cards", response.has("cards") ? response.get("cards") : result.arrayNode());
		result.set("boards", response.has("boards") ? response.get("boards") : result.arrayNode());
		return result;
	}

}
