/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello;

import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.config.GatewayConfig;
import io.trellomcp.gateway.server.GatewayServer;
import io.trellomcp.gateway.server.McpToolDispatcher;
import io.trellomcp.gateway.server.auth.CredentialStore;
import io.trellomcp.gateway.server.session.SessionLifecycleManager;
import io.trellomcp.gateway.server.session.SessionRegistry;
import io.trellomcp.gateway.server.transport.StdioServerTransport;
import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.tool.TrelloToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the Trello MCP server, over stdio when {@code USE_CLAUDE_APP} is set (the
 * default) and over streamable HTTP otherwise.
 */
public final class TrelloMcpServer {

	private static final Logger logger = LoggerFactory.getLogger(TrelloMcpServer.class);

	static final String SERVER_NAME = "trello-mcp-server";

	static final String SERVER_VERSION = "0.1.0";

	private TrelloMcpServer() {
	}

	public static void main(String[] args) throws Exception {
		Map<String, String> env = System.getenv();
		GatewayConfig config = GatewayConfig.fromEnvironment(env);
		TrelloConfig trelloConfig = TrelloConfig.fromEnvironment(env);
		logger.info("Starting {} with {}", SERVER_NAME, config);

		ObjectMapper objectMapper = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
		McpToolDispatcher dispatcher = createDispatcher(new TrelloClient(trelloConfig, objectMapper), objectMapper);

		if (config.isStdio()) {
			new StdioServerTransport(dispatcher, objectMapper).run();
			return;
		}

		CredentialStore credentialStore = config.credentialStore();
		try (SessionLifecycleManager lifecycleManager = SessionLifecycleManager.open(() -> SessionRegistry.builder()
			.sessionTimeout(config.getSessionTimeout())
			.keepAliveInterval(config.getKeepAliveInterval())
			.build());
				GatewayServer server = new GatewayServer(config, credentialStore, dispatcher, lifecycleManager,
						objectMapper)) {
			lifecycleManager.registerShutdownHook();
			server.start();
			server.join();
		}
	}

	static McpToolDispatcher createDispatcher(TrelloClient client, ObjectMapper objectMapper) {
		return McpToolDispatcher.builder()
			.serverInfo(SERVER_NAME, SERVER_VERSION)
			.instructions("Tools to read and manage Trello boards, lists, cards, checklists, attachments and custom fields.")
			.objectMapper(objectMapper)
			.tools(TrelloToolCatalog.create(client))
			.build();
	}

}
