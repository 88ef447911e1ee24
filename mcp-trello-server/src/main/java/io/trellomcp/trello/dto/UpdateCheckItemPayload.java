/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PUT /cards/{idCard}/checkItem/{idCheckItem}}.
 *
 * @param name new text of the item
 * @param state {@code complete} or {@code incomplete}
 * @param pos new position
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateCheckItemPayload( // @formatter:off
	@JsonProperty("name") String name,
	@JsonProperty("state") String state,
	@JsonProperty("pos") String pos) { // @formatter:on
}
