/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.service.CustomFieldService;

public class CustomFieldTools extends AbstractTrelloTools {

	static final String UPDATE_VALUE_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string"
					},
					"custom_field_id": {
						"type": "string"
					},
					"value": {
						"type": "object",
						"description": "The typed value, e.g. {text: High}, {number: 3}, {checked: true}, {date: ISO 8601} or {idValue: option id}. A full body wrapping it under value is accepted as well."
					}
				},
				"required": ["card_id", "custom_field_id", "value"]
			}
			""";

	private final CustomFieldService customFieldService;

	public CustomFieldTools(CustomFieldService customFieldService, ObjectMapper objectMapper) {
		super(objectMapper);
		this.customFieldService = customFieldService;
	}

	@Override
	public List<ToolSpecification> specifications() {
		return List.of(
				readTool("get_board_custom_field_definitions", "Retrieves the custom field definitions of a board.",
						BoardTools.BOARD_ID_SCHEMA,
						args -> this.customFieldService.getBoardCustomFields(args.requireString("board_id"))),
				readTool("get_card_custom_field_items", "Retrieves the custom field values set on a card.",
						CardTools.CARD_ID_SCHEMA,
						args -> this.customFieldService.getCardCustomFieldItems(args.requireString("card_id"))),
				writeTool("update_card_custom_field_value", "Sets the value of a custom field on a card.",
						UPDATE_VALUE_SCHEMA,
						args -> this.customFieldService.updateCardCustomFieldValue(args.requireString("card_id"),
								args.requireString("custom_field_id"), args.requireObject("value"))));
	}

}
