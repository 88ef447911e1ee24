/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A board label. Labels without a name are shown by color only.
 *
 * @param id the label id
 * @param name the label name, may be empty
 * @param color the label color, {@code null} for colorless labels
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloLabel( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("color") String color) { // @formatter:on
}
