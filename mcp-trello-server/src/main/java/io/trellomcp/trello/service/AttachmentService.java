/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.dto.AddAttachmentPayload;
import reactor.core.publisher.Mono;

public class AttachmentService extends AbstractTrelloService {

	public AttachmentService(TrelloClient client) {
		super(client);
	}

	public Mono<JsonNode> getAttachments(String cardId) {
		return this.client.get("/cards/" + requireId(cardId, "card_id") + "/attachments");
	}

	public Mono<JsonNode> addAttachment(String cardId, AddAttachmentPayload payload) {
		requireId(payload.url(), "url");
		return this.client.post("/cards/" + requireId(cardId, "card_id") + "/attachments", payload);
	}

	public Mono<JsonNode> deleteAttachment(String cardId, String attachmentId) {
		return this.client.delete("/cards/" + requireId(cardId, "card_id") + "/attachments/"
				+ requireId(attachmentId, "attachment_id"));
	}

}
