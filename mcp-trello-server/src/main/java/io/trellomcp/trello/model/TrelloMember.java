/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloMember( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("fullName") String fullName,
	@JsonProperty("username") String username,
	@JsonProperty("email") String email,
	@JsonProperty("url") String url) { // @formatter:on
}
