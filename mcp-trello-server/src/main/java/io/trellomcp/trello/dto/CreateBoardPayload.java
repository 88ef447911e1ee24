/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /boards}.
 *
 * @param name the board name
 * @param desc optional description
 * @param idOrganization optional workspace to create the board in
 * @param defaultLists whether Trello creates the default lists
 * @param prefsBackground background color or image
 * @param prefsPermissionLevel {@code private}, {@code org} or {@code public}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateBoardPayload( // @formatter:off
	@JsonProperty("name") String name,
	@JsonProperty("desc") String desc,
	@JsonProperty("idOrganization") String idOrganization,
	@JsonProperty("defaultLists") Boolean defaultLists,
	@JsonProperty("prefs_background") String prefsBackground,
	@JsonProperty("prefs_permissionLevel") String prefsPermissionLevel) { // @formatter:on

	public CreateBoardPayload {
		defaultLists = defaultLists != null ? defaultLists : Boolean.TRUE;
		prefsBackground = prefsBackground != null ? prefsBackground : "blue";
		prefsPermissionLevel = prefsPermissionLevel != null ? prefsPermissionLevel : "private";
	}
}
