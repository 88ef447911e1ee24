/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateListPayload( // @formatter:off
	@JsonProperty("name") String name,
	@JsonProperty("idBoard") String idBoard,
	@JsonProperty("pos") String pos) { // @formatter:on
}
