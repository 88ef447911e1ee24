/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateLabelPayload( // @formatter:off
	@JsonProperty("name") String name,
	@JsonProperty("color") String color) { // @formatter:on
}
