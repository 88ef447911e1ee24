/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Trello board.
 *
 * @param id the board id
 * @param name the board name
 * @param desc the description, may be {@code null}
 * @param closed whether the board is archived
 * @param idOrganization the owning workspace, may be {@code null}
 * @param url the board URL
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloBoard( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("desc") String desc,
	@JsonProperty("closed") boolean closed,
	@JsonProperty("idOrganization") String idOrganization,
	@JsonProperty("url") String url) { // @formatter:on
}
