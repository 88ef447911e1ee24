/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloChecklist( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("idBoard") String idBoard,
	@JsonProperty("idCard") String idCard,
	@JsonProperty("pos") Double pos,
	@JsonProperty("checkItems") List<TrelloCheckItem> checkItems) { // @formatter:on

	public TrelloChecklist {
		checkItems = checkItems != null ? List.copyOf(checkItems) : List.of();
	}
}
