/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AddAttachmentPayload( // @formatter:off
	@JsonProperty("url") String url,
	@JsonProperty("name") String name) { // @formatter:on
}
