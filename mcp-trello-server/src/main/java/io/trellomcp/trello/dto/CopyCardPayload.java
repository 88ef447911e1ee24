/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /cards} when cloning an existing card.
 *
 * @param idCardSource the card to copy
 * @param idList the target list
 * @param name optional new name
 * @param desc optional new description
 * @param keepFromSource components to keep, defaults to {@code all}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CopyCardPayload( // @formatter:off
	@JsonProperty("idCardSource") String idCardSource,
	@JsonProperty("idList") String idList,
	@JsonProperty("name") String name,
	@JsonProperty("desc") String desc,
	@JsonProperty("keepFromSource") String keepFromSource) { // @formatter:on

	public CopyCardPayload {
		keepFromSource = keepFromSource != null ? keepFromSource : "all";
	}
}
