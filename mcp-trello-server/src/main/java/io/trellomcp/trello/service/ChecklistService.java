/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.dto.CreateCheckItemPayload;
import io.trellomcp.trello.dto.CreateChecklistPayload;
import io.trellomcp.trello.dto.UpdateCheckItemPayload;
import io.trellomcp.trello.dto.UpdateChecklistPayload;
import io.trellomcp.trello.model.TrelloCheckItem;
import io.trellomcp.trello.model.TrelloChecklist;
import reactor.core.publisher.Mono;

public class ChecklistService extends AbstractTrelloService {

	public ChecklistService(TrelloClient client) {
		super(client);
	}

	public Mono<TrelloChecklist> getChecklist(String checklistId) {
		return as(this.client.get("/checklists/" + requireId(checklistId, "checklist_id")), TrelloChecklist.class);
	}

	public Mono<List<TrelloChecklist>> getCardChecklists(String cardId) {
		return asList(this.client.get("/cards/" + requireId(cardId, "card_id") + "/checklists"),
				TrelloChecklist.class);
	}

	public Mono<TrelloChecklist> createChecklist(CreateChecklistPayload payload) {
		requireId(payload.idCard(), "card_id");
		return as(this.client.post("/checklists", payload), TrelloChecklist.class);
	}

	public Mono<TrelloChecklist> updateChecklist(String checklistId, UpdateChecklistPayload payload) {
		return as(this.client.put("/checklists/" + requireId(checklistId, "checklist_id"), payload),
				TrelloChecklist.class);
	}

	public Mono<JsonNode> deleteChecklist(String checklistId) {
		return this.client.delete("/checklists/" + requireId(checklistId, "checklist_id"));
	}

	public Mono<TrelloCheckItem> addCheckItem(String checklistId, CreateCheckItemPayload payload) {
		return as(this.client.post("/checklists/" + requireId(checklistId, "checklist_id") + "/checkItems", payload),
				TrelloCheckItem.class);
	}

	/**
	 * Check items are updated through the card that holds the checklist.
	 * @param cardId the card holding the checklist
	 * @param checkItemId the item
	 * @param payload the changes
	 * @return the updated item
	 */
	public Mono<TrelloCheckItem> updateCheckItem(String cardId, String checkItemId, UpdateCheckItemPayload payload) {
		return as(this.client.put(
				"/cards/" + requireId(cardId, "card_id") + "/checkItem/" + requireId(checkItemId, "checkitem_id"),
				payload), TrelloCheckItem.class);
	}

	public Mono<JsonNode> deleteCheckItem(String checklistId, String checkItemId) {
		return this.client.delete("/checklists/" + requireId(checklistId, "checklist_id") + "/checkItems/"
				+ requireId(checkItemId, "checkitem_id"));
	}

}
