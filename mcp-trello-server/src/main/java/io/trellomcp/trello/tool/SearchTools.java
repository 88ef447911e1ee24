/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.service.SearchService;

public class SearchTools extends AbstractTrelloTools {

	static final String SEARCH_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"query": {
						"type": "string",
						"description": "The search terms, partial words match"
					}
				},
				"required": ["query"]
			}
			""";

	private final SearchService searchService;

	public SearchTools(SearchService searchService, ObjectMapper objectMapper) {
		super(objectMapper);
		this.searchService = searchService;
	}

	@Override
	public List<ToolSpecification> specifications() {
		return List.of(readTool("search_trello", "Searches cards and boards. Returns up to 20 of each.",
				SEARCH_SCHEMA, args -> this.searchService.search(args.requireString("query"))));
	}

}
