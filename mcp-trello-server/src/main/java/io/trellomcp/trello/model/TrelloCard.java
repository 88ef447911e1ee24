/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Trello card.
 *
 * @param id the card id
 * @param name the card title
 * @param desc the description, may be {@code null}
 * @param closed whether the card is archived
 * @param idList the list holding the card
 * @param idBoard the board holding the card
 * @param url the card URL
 * @param pos the position within the list
 * @param labels the labels attached to the card
 * @param due the due date as ISO-8601 text, may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloCard( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("desc") String desc,
	@JsonProperty("closed") boolean closed,
	@JsonProperty("idList") String idList,
	@JsonProperty("idBoard") String idBoard,
	@JsonProperty("url") String url,
	@JsonProperty("pos") Double pos,
	@JsonProperty("labels") List<TrelloLabel> labels,
	@JsonProperty("due") String due) { // @formatter:on

	public TrelloCard {
		labels = labels != null ? List.copyOf(labels) : List.of();
	}
}
