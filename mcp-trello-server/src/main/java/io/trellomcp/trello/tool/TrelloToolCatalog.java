/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.ArrayList;
import java.util.List;

import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.service.AttachmentService;
import io.trellomcp.trello.service.BoardService;
import io.trellomcp.trello.service.CardService;
import io.trellomcp.trello.service.ChecklistService;
import io.trellomcp.trello.service.CustomFieldService;
import io.trellomcp.trello.service.ListService;
import io.trellomcp.trello.service.SearchService;

/**
 * All Trello tools backed by a single {@link TrelloClient}.
 */
public final class TrelloToolCatalog {

	private TrelloToolCatalog() {
	}

	public static List<ToolSpecification> create(TrelloClient client) {
		List<AbstractTrelloTools> groups = List.of(
				new BoardTools(new BoardService(client), client.getObjectMapper()),
				new ListTools(new ListService(client), client.getObjectMapper()),
				new CardTools(new CardService(client), client.getObjectMapper()),
				new ChecklistTools(new ChecklistService(client), client.getObjectMapper()),
				new AttachmentTools(new AttachmentService(client), client.getObjectMapper()),
				new CustomFieldTools(new CustomFieldService(client), client.getObjectMapper()),
				new SearchTools(new SearchService(client), client.getObjectMapper()));
		List<ToolSpecification> specifications = new ArrayList<>();
		groups.forEach(group -> specifications.addAll(group.specifications()));
		return specifications;
	}

}
