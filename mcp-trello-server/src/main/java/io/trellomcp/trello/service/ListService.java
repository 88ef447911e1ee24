/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.List;
import java.util.Map;

import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.dto.CreateListPayload;
import io.trellomcp.trello.dto.UpdateListPayload;
import io.trellomcp.trello.model.TrelloList;
import reactor.core.publisher.Mono;

public class ListService extends AbstractTrelloService {

	public ListService(TrelloClient client) {
		super(client);
	}

	public Mono<TrelloList> getList(String listId) {
		return as(this.client.get("/lists/" + requireId(listId, "list_id")), TrelloList.class);
	}

	public Mono<List<TrelloList>> getLists(String boardId) {
		return asList(this.client.get("/boards/" + requireId(boardId, "board_id") + "/lists"), TrelloList.class);
	}

	public Mono<TrelloList> createList(CreateListPayload payload) {
		requireId(payload.idBoard(), "board_id");
		CreateListPayload body = payload.pos() != null ? payload
				: new CreateListPayload(payload.name(), payload.idBoard(), "bottom");
		return as(this.client.post("/lists", body), TrelloList.class);
	}

	public Mono<TrelloList> updateList(String listId, UpdateListPayload payload) {
		return as(this.client.put("/lists/" + requireId(listId, "list_id"), payload), TrelloList.class);
	}

	/**
	 * Lists cannot be deleted through the API; they are archived instead.
	 * @param listId the list
	 * @return the archived list
	 */
	public Mono<TrelloList> archiveList(String listId) {
		return as(this.client.put("/lists/" + requireId(listId, "list_id") + "/closed", Map.of("value", true), null),
				TrelloList.class);
	}

}
