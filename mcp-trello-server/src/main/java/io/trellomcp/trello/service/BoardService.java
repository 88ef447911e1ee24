/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.dto.CreateBoardPayload;
import io.trellomcp.trello.dto.CreateLabelPayload;
import io.trellomcp.trello.dto.UpdateBoardPayload;
import io.trellomcp.trello.model.TrelloBoard;
import io.trellomcp.trello.model.TrelloLabel;
import io.trellomcp.trello.model.TrelloMember;
import io.trellomcp.trello.model.TrelloWorkspace;
import reactor.core.publisher.Mono;

/**
 * Boards, their labels, members and activity, and the workspaces that own them.
 */
public class BoardService extends AbstractTrelloService {

	public BoardService(TrelloClient client) {
		super(client);
	}

	public Mono<TrelloBoard> getBoard(String boardId) {
		return as(this.client.get("/boards/" + requireId(boardId, "board_id")), TrelloBoard.class);
	}

	/**
	 * Boards of the current member.
	 * @param filter {@code open}, {@code closed}, {@code all}, ...; {@code null} for
	 * {@code open}
	 * @return the boards
	 */
	public Mono<List<TrelloBoard>> getBoards(String filter) {
		return asList(this.client.get("/members/me/boards", Map.of("filter", filter != null ? filter : "open")),
				TrelloBoard.class);
	}

	public Mono<List<TrelloWorkspace>> getWorkspaces() {
		return asList(this.client.get("/members/me/organizations"), TrelloWorkspace.class);
	}

	public Mono<List<TrelloBoard>> getWorkspaceBoards(String workspaceId, String filter) {
		return asList(this.client.get("/organizations/" + requireId(workspaceId, "workspace_id") + "/boards",
				Map.of("filter", filter != null ? filter : "open")), TrelloBoard.class);
	}

	public Mono<List<TrelloLabel>> getBoardLabels(String boardId) {
		return asList(this.client.get("/boards/" + requireId(boardId, "board_id") + "/labels"), TrelloLabel.class);
	}

	public Mono<TrelloLabel> createBoardLabel(String boardId, CreateLabelPayload payload) {
		return as(this.client.post("/boards/" + requireId(boardId, "board_id") + "/labels", payload),
				TrelloLabel.class);
	}

	public Mono<List<TrelloMember>> getBoardMembers(String boardId) {
		return asList(this.client.get("/boards/" + requireId(boardId, "board_id") + "/members"), TrelloMember.class);
	}

	public Mono<TrelloMember> getMe() {
		return as(this.client.get("/members/me"), TrelloMember.class);
	}

	/**
	 * Recent activity of a board.
	 * @param boardId the board
	 * @param filter action types, {@code null} for {@code all}
	 * @param limit maximum number of actions, {@code null} for 50
	 * @return the raw actions
	 */
	public Mono<JsonNode> getBoardActions(String boardId, String filter, Integer limit) {
		Map<String, Object> params = new LinkedHashMap<>();
		params.put("filter", filter != null ? filter : "all");
		params.put("limit", limit != null ? limit : 50);
		return this.client.get("/boards/" + requireId(boardId, "board_id") + "/actions", params);
	}

	public Mono<TrelloBoard> createBoard(CreateBoardPayload payload) {
		return as(this.client.post("/boards", payload), TrelloBoard.class);
	}

	public Mono<TrelloBoard> updateBoard(String boardId, UpdateBoardPayload payload) {
		return as(this.client.put("/boards/" + requireId(boardId, "board_id"), payload), TrelloBoard.class);
	}

}
