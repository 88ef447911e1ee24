/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.dto.CreateCheckItemPayload;
import io.trellomcp.trello.dto.CreateChecklistPayload;
import io.trellomcp.trello.dto.UpdateCheckItemPayload;
import io.trellomcp.trello.dto.UpdateChecklistPayload;
import io.trellomcp.trello.service.ChecklistService;

public class ChecklistTools extends AbstractTrelloTools {

	static final String CHECKLIST_ID_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"checklist_id": {
						"type": "string",
						"description": "The ID of the checklist"
					}
				},
				"required": ["checklist_id"]
			}
			""";

	static final String CREATE_CHECKLIST_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string"
					},
					"name": {
						"type": "string"
					},
					"pos": {
						"type": "string"
					}
				},
				"required": ["card_id", "name"]
			}
			""";

	static final String UPDATE_CHECKLIST_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"checklist_id": {
						"type": "string"
					},
					"name": {
						"type": "string"
					},
					"pos": {
						"type": "string"
					}
				},
				"required": ["checklist_id"]
			}
			""";

	static final String ADD_CHECKITEM_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"checklist_id": {
						"type": "string"
					},
					"name": {
						"type": "string"
					},
					"checked": {
						"type": "boolean",
						"description": "Whether the item starts checked, defaults to false"
					},
					"pos": {
						"type": "string"
					}
				},
				"required": ["checklist_id", "name"]
			}
			""";

	static final String UPDATE_CHECKITEM_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string",
						"description": "The card holding the checklist"
					},
					"checkitem_id": {
						"type": "string"
					},
					"name": {
						"type": "string"
					},
					"state": {
						"type": "string",
						"enum": ["complete", "incomplete"]
					},
					"pos": {
						"type": "string"
					}
				},
				"required": ["card_id", "checkitem_id"]
			}
			""";

	static final String DELETE_CHECKITEM_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"checklist_id": {
						"type": "string"
					},
					"checkitem_id": {
						"type": "string"
					}
				},
				"required": ["checklist_id", "checkitem_id"]
			}
			""";

	private final ChecklistService checklistService;

	public ChecklistTools(ChecklistService checklistService, ObjectMapper objectMapper) {
		super(objectMapper);
		this.checklistService = checklistService;
	}

	@Override
	public List<ToolSpecification> specifications() {
		return List.of(
				readTool("get_checklist", "Retrieves a specific checklist by its ID.", CHECKLIST_ID_SCHEMA,
						args -> this.checklistService.getChecklist(args.requireString("checklist_id"))),
				readTool("get_card_checklists", "Retrieves the checklists of a card.", CardTools.CARD_ID_SCHEMA,
						args -> this.checklistService.getCardChecklists(args.requireString("card_id"))),
				writeTool("create_checklist", "Creates a checklist on a card.", CREATE_CHECKLIST_SCHEMA,
						args -> this.checklistService.createChecklist(new CreateChecklistPayload(
								args.requireString("card_id"), args.requireString("name"), args.optionalString("pos")))),
				writeTool("update_checklist", "Renames or moves a checklist.", UPDATE_CHECKLIST_SCHEMA,
						args -> this.checklistService.updateChecklist(args.requireString("checklist_id"),
								new UpdateChecklistPayload(args.optionalString("name"), args.optionalString("pos")))),
				writeTool("delete_checklist", "Deletes a checklist.", CHECKLIST_ID_SCHEMA,
						args -> this.checklistService.deleteChecklist(args.requireString("checklist_id"))
							.thenReturn("Checklist " + args.requireString("checklist_id") + " deleted")),
				writeTool("add_checkitem", "Adds an item to a checklist.", ADD_CHECKITEM_SCHEMA,
						args -> this.checklistService.addCheckItem(args.requireString("checklist_id"),
								new CreateCheckItemPayload(args.requireString("name"), args.optionalBoolean("checked"),
										args.optionalString("pos")))),
				writeTool("update_checkitem", "Renames, moves, checks or unchecks a checklist item.",
						UPDATE_CHECKITEM_SCHEMA,
						args -> this.checklistService.updateCheckItem(args.requireString("card_id"),
								args.requireString("checkitem_id"), new UpdateCheckItemPayload(
										args.optionalString("name"), args.optionalString("state"),
										args.optionalString("pos")))),
				writeTool("delete_checkitem", "Deletes an item from a checklist.", DELETE_CHECKITEM_SCHEMA,
						args -> this.checklistService
							.deleteCheckItem(args.requireString("checklist_id"), args.requireString("checkitem_id"))
							.thenReturn("Check item " + args.requireString("checkitem_id") + " deleted")));
	}

}
