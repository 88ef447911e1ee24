/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateCardPayload( // @formatter:off
	@JsonProperty("name") String name,
	@JsonProperty("desc") String desc,
	@JsonProperty("closed") Boolean closed,
	@JsonProperty("idList") String idList,
	@JsonProperty("pos") String pos,
	@JsonProperty("due") String due,
	@JsonProperty("start") String start,
	@JsonProperty("dueComplete") Boolean dueComplete,
	@JsonProperty("idLabels") List<String> idLabels,
	@JsonProperty("idMembers") List<String> idMembers) { // @formatter:on
}
