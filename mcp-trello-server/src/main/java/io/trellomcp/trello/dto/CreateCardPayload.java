/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /cards}.
 *
 * @param idList the list to create the card in
 * @param name the card title
 * @param desc optional description
 * @param pos {@code top}, {@code bottom} or a positive number
 * @param due optional due date
 * @param start optional start date
 * @param idLabels labels to attach
 * @param idMembers members to assign
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateCardPayload( // @formatter:off
	@JsonProperty("idList") String idList,
	@JsonProperty("name") String name,
	@JsonProperty("desc") String desc,
	@JsonProperty("pos") String pos,
	@JsonProperty("due") String due,
	@JsonProperty("start") String start,
	@JsonProperty("idLabels") List<String> idLabels,
	@JsonProperty("idMembers") List<String> idMembers) { // @formatter:on
}
