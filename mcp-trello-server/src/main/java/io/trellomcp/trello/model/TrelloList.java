/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloList( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("closed") boolean closed,
	@JsonProperty("idBoard") String idBoard,
	@JsonProperty("pos") Double pos) { // @formatter:on
}
