/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.dto.CopyCardPayload;
import io.trellomcp.trello.dto.CreateCardPayload;
import io.trellomcp.trello.dto.UpdateCardPayload;
import io.trellomcp.trello.service.CardService;

/**
 * Card tools, including comments and card membership.
 */
public class CardTools extends AbstractTrelloTools {

	static final String CARD_ID_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string",
						"description": "The ID of the card"
					}
				},
				"required": ["card_id"]
			}
			""";

	static final String CREATE_CARD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"list_id": {
						"type": "string",
						"description": "The list to add the card to"
					},
					"name": {
						"type": "string"
					},
					"desc": {
						"type": "string"
					},
					"pos": {
						"type": "string",
						"description": "top, bottom or a positive number"
					},
					"due": {
						"type": "string",
						"description": "Due date in ISO 8601 format"
					},
					"start": {
						"type": "string",
						"description": "Start date in ISO 8601 format"
					},
					"idLabels": {
						"type": "array",
						"items": { "type": "string" }
					},
					"idMembers": {
						"type": "array",
						"items": { "type": "string" }
					}
				},
				"required": ["list_id", "name"]
			}
			""";

	static final String UPDATE_CARD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string"
					},
					"name": {
						"type": "string"
					},
					"desc": {
						"type": "string"
					},
					"closed": {
						"type": "boolean",
						"description": "Archives the card when true"
					},
					"idList": {
						"type": "string",
						"description": "Moves the card to this list"
					},
					"pos": {
						"type": "string"
					},
					"due": {
						"type": "string"
					},
					"start": {
						"type": "string"
					},
					"dueComplete": {
						"type": "boolean"
					},
					"idLabels": {
						"type": "array",
						"items": { "type": "string" }
					},
					"idMembers": {
						"type": "array",
						"items": { "type": "string" }
					}
				},
				"required": ["card_id"]
			}
			""";

	static final String COMMENT_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string"
					},
					"text": {
						"type": "string",
						"description": "The comment text"
					}
				},
				"required": ["card_id", "text"]
			}
			""";

	static final String CARD_MEMBER_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string"
					},
					"member_id": {
						"type": "string"
					}
				},
				"required": ["card_id", "member_id"]
			}
			""";

	static final String COPY_CARD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"source_card_id": {
						"type": "string",
						"description": "The card to copy"
					},
					"list_id": {
						"type": "string",
						"description": "The list to put the copy in"
					},
					"name": {
						"type": "string",
						"description": "Name of the copy, defaults to the source name"
					},
					"desc": {
						"type": "string"
					},
					"keepFromSource": {
						"type": "string",
						"description": "Properties to copy, e.g. all (default), checklists, labels, members, due"
					}
				},
				"required": ["source_card_id", "list_id"]
			}
			""";

	private final CardService cardService;

	public CardTools(CardService cardService, ObjectMapper objectMapper) {
		super(objectMapper);
		this.cardService = cardService;
	}

	@Override
	public List<ToolSpecification> specifications() {
		return List.of(
				readTool("get_card", "Retrieves a specific card by its ID.", CARD_ID_SCHEMA,
						args -> this.cardService.getCard(args.requireString("card_id"))),
				readTool("get_cards", "Retrieves the cards of a list.", ListTools.LIST_ID_SCHEMA,
						args -> this.cardService.getCards(args.requireString("list_id"))),
				writeTool("create_card", "Creates a new card in a list.", CREATE_CARD_SCHEMA,
						args -> this.cardService.createCard(new CreateCardPayload(args.requireString("list_id"),
								args.requireString("name"), args.optionalString("desc"), args.optionalString("pos"),
								args.optionalString("due"), args.optionalString("start"),
								args.optionalStringList("idLabels"), args.optionalStringList("idMembers")))),
				writeTool("update_card", "Updates the attributes of a card or moves it to another list.",
						UPDATE_CARD_SCHEMA,
						args -> this.cardService.updateCard(args.requireString("card_id"),
								new UpdateCardPayload(args.optionalString("name"), args.optionalString("desc"),
										args.optionalBoolean("closed"), args.optionalString("idList"),
										args.optionalString("pos"), args.optionalString("due"),
										args.optionalString("start"), args.optionalBoolean("dueComplete"),
										args.optionalStringList("idLabels"), args.optionalStringList("idMembers")))),
				writeTool("delete_card", "Permanently deletes a card.", CARD_ID_SCHEMA,
						args -> this.cardService.deleteCard(args.requireString("card_id"))
							.thenReturn("Card " + args.requireString("card_id") + " deleted")),
				readTool("get_card_comments", "Retrieves the comments on a card.", CARD_ID_SCHEMA,
						args -> this.cardService.getComments(args.requireString("card_id"))),
				writeTool("add_comment_to_card", "Adds a comment to a card.", COMMENT_SCHEMA,
						args -> this.cardService.addComment(args.requireString("card_id"), args.requireString("text"))),
				writeTool("add_member_to_card", "Assigns a member to a card.", CARD_MEMBER_SCHEMA,
						args -> this.cardService.addMember(args.requireString("card_id"),
								args.requireString("member_id"))),
				writeTool("remove_member_from_card", "Removes a member from a card.", CARD_MEMBER_SCHEMA,
						args -> this.cardService.removeMember(args.requireString("card_id"),
								args.requireString("member_id"))),
				writeTool("copy_card", "Copies a card into a list.", COPY_CARD_SCHEMA,
						args -> this.cardService.copyCard(new CopyCardPayload(args.requireString("source_card_id"),
								args.requireString("list_id"), args.optionalString("name"), args.optionalString("desc"),
								args.optionalString("keepFromSource")))));
	}

}
