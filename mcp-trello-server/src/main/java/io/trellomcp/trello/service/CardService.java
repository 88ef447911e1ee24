/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.dto.CopyCardPayload;
import io.trellomcp.trello.dto.CreateCardPayload;
import io.trellomcp.trello.dto.UpdateCardPayload;
import io.trellomcp.trello.model.TrelloCard;
import reactor.core.publisher.Mono;

/**
 * Cards, their comments and their members.
 */
public class CardService extends AbstractTrelloService {

	public CardService(TrelloClient client) {
		super(client);
	}

	public Mono<TrelloCard> getCard(String cardId) {
		return as(this.client.get("/cards/" + requireId(cardId, "card_id")), TrelloCard.class);
	}

	public Mono<List<TrelloCard>> getCards(String listId) {
		return asList(this.client.get("/lists/" + requireId(listId, "list_id") + "/cards"), TrelloCard.class);
	}

	public Mono<TrelloCard> createCard(CreateCardPayload payload) {
		requireId(payload.idList(), "idList");
		return as(this.client.post("/cards", payload), TrelloCard.class);
	}

	public Mono<TrelloCard> updateCard(String cardId, UpdateCardPayload payload) {
		return as(this.client.put("/cards/" + requireId(cardId, "card_id"), payload), TrelloCard.class);
	}

	public Mono<JsonNode> deleteCard(String cardId) {
		return this.client.delete("/cards/" + requireId(cardId, "card_id"));
	}

	public Mono<JsonNode> getComments(String cardId) {
		return this.client.get("/cards/" + requireId(cardId, "card_id") + "/actions",
				Map.of("filter", "commentCard"));
	}

	public Mono<JsonNode> addComment(String cardId, String text) {
		return this.client.post("/cards/" + requireId(cardId, "card_id") + "/actions/comments",
				Map.of("text", text));
	}

	public Mono<JsonNode> addMember(String cardId, String memberId) {
		return this.client.post("/cards/" + requireId(cardId, "card_id") + "/idMembers",
				Map.of("value", requireId(memberId, "member_id")));
	}

	public Mono<JsonNode> removeMember(String cardId, String memberId) {
		return this.client
			.delete("/cards/" + requireId(cardId, "card_id") + "/idMembers/" + requireId(memberId, "member_id"));
	}

	public Mono<TrelloCard> copyCard(CopyCardPayload payload) {
		requireId(payload.idCardSource(), "idCardSource");
		requireId(payload.idList(), "idList");
		return as(this.client.post("/cards", payload), TrelloCard.class);
	}

}
