/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An item of a checklist.
 *
 * @param id the item id
 * @param name the item text
 * @param state {@code complete} or {@code incomplete}
 * @param idChecklist the owning checklist
 * @param pos the position within the checklist
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloCheckItem( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("state") String state,
	@JsonProperty("idChecklist") String idChecklist,
	@JsonProperty("pos") Double pos) { // @formatter:on
}
