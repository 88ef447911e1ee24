/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.dto.CreateListPayload;
import io.trellomcp.trello.dto.UpdateListPayload;
import io.trellomcp.trello.service.ListService;

public class ListTools extends AbstractTrelloTools {

	static final String LIST_ID_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"list_id": {
						"type": "string",
						"description": "The ID of the list"
					}
				},
				"required": ["list_id"]
			}
			""";

	static final String CREATE_LIST_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"board_id": {
						"type": "string",
						"description": "The board to add the list to"
					},
					"name": {
						"type": "string"
					},
					"pos": {
						"type": "string",
						"description": "top, bottom (default) or a positive number"
					}
				},
				"required": ["board_id", "name"]
			}
			""";

	static final String UPDATE_LIST_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"list_id": {
						"type": "string"
					},
					"name": {
						"type": "string"
					},
					"closed": {
						"type": "boolean"
					},
					"pos": {
						"type": "string",
						"description": "top, bottom or a positive number"
					}
				},
				"required": ["list_id"]
			}
			""";

	private final ListService listService;

	public ListTools(ListService listService, ObjectMapper objectMapper) {
		super(objectMapper);
		this.listService = listService;
	}

	@Override
	public List<ToolSpecification> specifications() {
		return List.of(
				readTool("get_list", "Retrieves a specific list by its ID.", LIST_ID_SCHEMA,
						args -> this.listService.getList(args.requireString("list_id"))),
				readTool("get_lists", "Retrieves the lists of a board.", BoardTools.BOARD_ID_SCHEMA,
						args -> this.listService.getLists(args.requireString("board_id"))),
				writeTool("create_list", "Creates a new list on a board.", CREATE_LIST_SCHEMA,
						args -> this.listService.createList(new CreateListPayload(args.requireString("name"),
								args.requireString("board_id"), args.optionalString("pos")))),
				writeTool("update_list", "Updates the name, position or archive state of a list.", UPDATE_LIST_SCHEMA,
						args -> this.listService.updateList(args.requireString("list_id"),
								new UpdateListPayload(args.optionalString("name"), args.optionalBoolean("closed"),
										args.optionalString("pos")))),
				writeTool("delete_list", "Archives a list. Trello lists cannot be deleted permanently.",
						LIST_ID_SCHEMA, args -> this.listService.archiveList(args.requireString("list_id"))));
	}

}
