/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.trellomcp.gateway.util.Assert;
import io.trellomcp.trello.client.TrelloClient;
import reactor.core.publisher.Mono;

public class CustomFieldService extends AbstractTrelloService {

	public CustomFieldService(TrelloClient client) {
		super(client);
	}

	public Mono<JsonNode> getBoardCustomFields(String boardId) {
		return this.client.get("/boards/" + requireId(boardId, "board_id") + "/customFields");
	}

	public Mono<JsonNode> getCardCustomFieldItems(String cardId) {
		return this.client.get("/cards/" + requireId(cardId, "card_id") + "/customFieldItems");
	}

	/**
	 * Sets the value of a custom field on a card.
	 * @param cardId the card
	 * @param customFieldId the custom field definition
	 * @param value either the typed value, e.g. {@code {"text": "High"}}, or the full
	 * body {@code {"value": {"text": "High"}}}
	 * @return the updated custom field item
	 */
	public Mono<JsonNode> updateCardCustomFieldValue(String cardId, String customFieldId, Map<String, Object> value) {
		Assert.notNull(value, "value must not be null");
		return this.client.put("/cards/" + requireId(cardId, "card_id") + "/customField/"
				+ requireId(customFieldId, "custom_field_id") + "/item", toBody(value));
	}

	static Map<String, Object> toBody(Map<String, Object> value) {
		return value.containsKey("value") ? value : Map.of("value", value);
	}

}
