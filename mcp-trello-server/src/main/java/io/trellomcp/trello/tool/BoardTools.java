/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.trello.dto.CreateBoardPayload;
import io.trellomcp.trello.dto.CreateLabelPayload;
import io.trellomcp.trello.dto.UpdateBoardPayload;
import io.trellomcp.trello.service.BoardService;

/**
 * Board, workspace and member tools.
 */
public class BoardTools extends AbstractTrelloTools {

	static final String BOARD_ID_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"board_id": {
						"type": "string",
						"description": "The ID of the board"
					}
				},
				"required": ["board_id"]
			}
			""";

	static final String NO_ARGUMENTS_SCHEMA = """
			{
				"type": "object",
				"properties": {}
			}
			""";

	static final String BOARDS_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"filter": {
						"type": "string",
						"description": "Which boards to return: open (default), closed, members, organization, public, starred or all"
					}
				}
			}
			""";

	static final String WORKSPACE_BOARDS_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"workspace_id": {
						"type": "string",
						"description": "The ID or name of the workspace"
					},
					"filter": {
						"type": "string",
						"description": "Which boards to return: open (default), closed, members, organization, public or all"
					}
				},
				"required": ["workspace_id"]
			}
			""";

	static final String CREATE_LABEL_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"board_id": {
						"type": "string"
					},
					"name": {
						"type": "string",
						"description": "The name of the label"
					},
					"color": {
						"type": "string",
						"description": "green, yellow, orange, red, purple, blue, sky, lime, pink or black"
					}
				},
				"required": ["board_id", "name"]
			}
			""";

	static final String BOARD_ACTIONS_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"board_id": {
						"type": "string"
					},
					"filter": {
						"type": "string",
						"description": "Comma separated action types, defaults to all"
					},
					"limit": {
						"type": "integer",
						"description": "Maximum number of actions, defaults to 50"
					}
				},
				"required": ["board_id"]
			}
			""";

	static final String CREATE_BOARD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"name": {
						"type": "string"
					},
					"desc": {
						"type": "string"
					},
					"idOrganization": {
						"type": "string",
						"description": "The workspace to create the board in"
					},
					"defaultLists": {
						"type": "boolean",
						"description": "Whether to add the default To Do, Doing and Done lists, defaults to true"
					},
					"prefs_background": {
						"type": "string",
						"description": "Background color, defaults to blue"
					},
					"prefs_permissionLevel": {
						"type": "string",
						"description": "private (default), org or public"
					}
				},
				"required": ["name"]
			}
			""";

	static final String UPDATE_BOARD_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"board_id": {
						"type": "string"
					},
					"name": {
						"type": "string"
					},
					"desc": {
						"type": "string"
					},
					"closed": {
						"type": "boolean",
						"description": "Archives the board when true"
					},
					"prefs_background": {
						"type": "string"
					}
				},
				"required": ["board_id"]
			}
			""";

	private final BoardService boardService;

	public BoardTools(BoardService boardService, ObjectMapper objectMapper) {
		super(objectMapper);
		this.boardService = boardService;
	}

	@Override
	public List<ToolSpecification> specifications() {
		return List.of(
				readTool("get_board", "Retrieves a specific board by its ID.", BOARD_ID_SCHEMA,
						args -> this.boardService.getBoard(args.requireString("board_id"))),
				readTool("get_boards", "Retrieves the boards of the current user.", BOARDS_SCHEMA,
						args -> this.boardService.getBoards(args.optionalString("filter"))),
				readTool("get_board_labels", "Retrieves the labels of a board.", BOARD_ID_SCHEMA,
						args -> this.boardService.getBoardLabels(args.requireString("board_id"))),
				writeTool("create_board_label", "Creates a label on a board.", CREATE_LABEL_SCHEMA,
						args -> this.boardService.createBoardLabel(args.requireString("board_id"),
								new CreateLabelPayload(args.requireString("name"), args.optionalString("color")))),
				readTool("get_board_members", "Retrieves the members of a board.", BOARD_ID_SCHEMA,
						args -> this.boardService.getBoardMembers(args.requireString("board_id"))),
				readTool("get_workspaces", "Retrieves the workspaces of the current user.", NO_ARGUMENTS_SCHEMA,
						args -> this.boardService.getWorkspaces()),
				readTool("get_workspace_boards", "Retrieves the boards of a workspace.", WORKSPACE_BOARDS_SCHEMA,
						args -> this.boardService.getWorkspaceBoards(args.requireString("workspace_id"),
								args.optionalString("filter"))),
				readTool("get_me", "Retrieves the member owning the configured Trello token.", NO_ARGUMENTS_SCHEMA,
						args -> this.boardService.getMe()),
				readTool("get_board_actions", "Retrieves the recent activity of a board.", BOARD_ACTIONS_SCHEMA,
						args -> this.boardService.getBoardActions(args.requireString("board_id"),
								args.optionalString("filter"), args.optionalInteger("limit"))),
				writeTool("create_board", "Creates a new board.", CREATE_BOARD_SCHEMA,
						args -> this.boardService.createBoard(new CreateBoardPayload(args.requireString("name"),
								args.optionalString("desc"), args.optionalString("idOrganization"),
								args.optionalBoolean("defaultLists"), args.optionalString("prefs_background"),
								args.optionalString("prefs_permissionLevel")))),
				writeTool("update_board", "Updates the name, description, background or archive state of a board.",
						UPDATE_BOARD_SCHEMA,
						args -> this.boardService.updateBoard(args.requireString("board_id"),
								new UpdateBoardPayload(args.optionalString("name"), args.optionalString("desc"),
										args.optionalBoolean("closed"), args.optionalString("prefs_background")))));
	}

}
