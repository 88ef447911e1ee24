/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Trello workspace, called organization in the REST API.
 *
 * @param id the workspace id
 * @param name the machine readable name
 * @param displayName the human readable name
 * @param url the workspace URL
 * @param desc the description, may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrelloWorkspace( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("displayName") String displayName,
	@JsonProperty("url") String url,
	@JsonProperty("desc") String desc) { // @formatter:on
}
