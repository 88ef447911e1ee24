/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.trellomcp.gateway.server.McpServerFeatures.ToolSpecification;
import io.trellomcp.gateway.spec.DefaultMcpTransportContext;
import io.trellomcp.gateway.spec.McpSchema.CallToolRequest;
import io.trellomcp.gateway.spec.McpSchema.CallToolResult;
import io.trellomcp.gateway.spec.McpSchema.TextContent;
import io.trellomcp.trello.client.TrelloApiException;
import io.trellomcp.trello.dto.CreateCardPayload;
import io.trellomcp.trello.model.TrelloCard;
import io.trellomcp.trello.service.CardService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CardToolsTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Mock
	private CardService cardService;

	private Map<String, ToolSpecification> tools;

	@BeforeEach
	void setUp() {
		CardTools cardTools = new CardTools(this.cardService, this.objectMapper);
		this.tools = new LinkedHashMap<>();
		cardTools.specifications().forEach(spec -> this.tools.put(spec.tool().name(), spec));
	}

	@Test
	void advertisesSchemasAndMutatingFlags() {
		assertThat(this.tools.get("get_card").mutating()).isFalse();
		assertThat(this.tools.get("create_card").mutating()).isTrue();
		assertThat(this.tools.get("create_card").tool().inputSchema().required()).containsExactly("list_id", "name");
		assertThat(this.tools.get("get_card").tool().annotations().readOnlyHint()).isTrue();
	}

	@Test
	void getCardRendersJson() {
		when(this.cardService.getCard("c1")).thenReturn(Mono.just(
				new TrelloCard("c1", "Fix", "", false, "l1", "b1", "https://trello.com/c/c1", 1.0, null, null)));

		StepVerifier.create(call("get_card", Map.of("card_id", "c1"))).assertNext(result -> {
			assertThat(result.isError()).isFalse();
			JsonNode json = parse(result);
			assertThat(json.get("id").asText()).isEqualTo("c1");
			assertThat(json.get("labels").isArray()).isTrue();
		}).verifyComplete();
	}

	@Test
	void createCardMapsArguments() {
		when(this.cardService.createCard(any())).thenReturn(Mono.just(
				new TrelloCard("c2", "New", null, false, "l1", "b1", null, null, List.of(), null)));

		StepVerifier.create(call("create_card",
				Map.of("list_id", "l1", "name", "New", "idLabels", List.of("lb1"), "due", "2025-01-01T00:00:00Z")))
			.assertNext(result -> assertThat(result.isError()).isFalse())
			.verifyComplete();

		verify(this.cardService).createCard(
				new CreateCardPayload("l1", "New", null, null, "2025-01-01T00:00:00Z", null, List.of("lb1"), null));
	}

	@Test
	void deleteCardReportsConfirmation() {
		when(this.cardService.deleteCard("c1")).thenReturn(Mono.just(NullNode.getInstance()));

		StepVerifier.create(call("delete_card", Map.of("card_id", "c1")))
			.assertNext(result -> assertThat(text(result)).isEqualTo("Card c1 deleted"))
			.verifyComplete();
	}

	@Test
	void missingArgumentsFailBeforeCallingTrello() {
		StepVerifier.create(call("add_comment_to_card", Map.of("card_id", "c1")))
			.expectErrorSatisfies(e -> assertThat(e).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("text"))
			.verify();

		verify(this.cardService, never()).addComment(anyString(), anyString());
	}

	@Test
	void trelloFailuresPropagate() {
		when(this.cardService.getCard("gone"))
			.thenReturn(Mono.error(new TrelloApiException("GET", "/cards/gone", 404, "not found")));

		StepVerifier.create(call("get_card", Map.of("card_id", "gone")))
			.expectError(TrelloApiException.class)
			.verify();
	}

	private Mono<CallToolResult> call(String name, Map<String, Object> arguments) {
		return this.tools.get(name)
			.callHandler()
			.apply(new DefaultMcpTransportContext(), new CallToolRequest(name, arguments));
	}

	private JsonNode parse(CallToolResult result) {
		try {
			return this.objectMapper.readTree(text(result));
		}
		catch (Exception e) {
			throw new AssertionError(e);
		}
	}

	private static String text(CallToolResult result) {
		return ((TextContent) result.content().get(0)).text();
	}

}
