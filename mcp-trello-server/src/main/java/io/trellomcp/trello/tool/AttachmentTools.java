/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.dto.AddAttachmentPayload;
import io.trellomcp.trello.service.AttachmentService;

public class AttachmentTools extends AbstractTrelloTools {

	static final String ADD_ATTACHMENT_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string"
					},
					"url": {
						"type": "string",
						"description": "The URL to attach"
					},
					"name": {
						"type": "string"
					}
				},
				"required": ["card_id", "url"]
			}
			""";

	static final String DELETE_ATTACHMENT_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"card_id": {
						"type": "string"
					},
					"attachment_id": {
						"type": "string"
					}
				},
				"required": ["card_id", "attachment_id"]
			}
			""";

	private final AttachmentService attachmentService;

	public AttachmentTools(AttachmentService attachmentService, ObjectMapper objectMapper) {
		super(objectMapper);
		this.attachmentService = attachmentService;
	}

	@Override
	public List<ToolSpecification> specifications() {
		return List.of(
				readTool("get_card_attachments", "Retrieves the attachments of a card.", CardTools.CARD_ID_SCHEMA,
						args -> this.attachmentService.getAttachments(args.requireString("card_id"))),
				writeTool("add_attachment_to_card", "Attaches a URL to a card.", ADD_ATTACHMENT_SCHEMA,
						args -> this.attachmentService.addAttachment(args.requireString("card_id"),
								new AddAttachmentPayload(args.requireString("url"), args.optionalString("name")))),
				writeTool("delete_attachment_from_card", "Removes an attachment from a card.",
						DELETE_ATTACHMENT_SCHEMA,
						args -> this.attachmentService
							.deleteAttachment(args.requireString("card_id"), args.requireString("attachment_id"))
							.thenReturn("Attachment " + args.requireString("attachment_id") + " deleted")));
	}

}
