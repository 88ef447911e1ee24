/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.service;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.trellomcp.trello.client.TrelloClient;
import io.trellomcp.trello.dto.CopyCardPayload;
import io.trellomcp.trello.dto.CreateCardPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CardServiceTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private TrelloClient client;

	private CardService cardService;

	@BeforeEach
	void setUp() {
		this.client = mock(TrelloClient.class);
		when(this.client.getObjectMapper()).thenReturn(this.objectMapper);
		this.cardService = new CardService(this.client);
	}

	@Test
	void mapsCardsWithLabels() throws Exception {
		when(this.client.get("/lists/l1/cards")).thenReturn(Mono.just(this.objectMapper.readTree("""
				[{"id":"c1","name":"Fix","idList":"l1","labels":[{"id":"lb1","name":"bug","color":"red"}]},
				 {"id":"c2","name":"Ship","idList":"l1"}]
				""")));

		StepVerifier.create(this.cardService.getCards("l1")).assertNext(cards -> {
			assertThat(cards).hasSize(2);
			assertThat(cards.get(0).labels()).extracting("color").containsExactly("red");
			assertThat(cards.get(1).labels()).isEmpty();
		}).verifyComplete();
	}

	@Test
	void createCardPostsPayload() throws Exception {
		when(this.client.post(anyString(), any())).thenReturn(Mono.just(this.objectMapper.readTree("{\"id\":\"c1\"}")));
		CreateCardPayload payload = new CreateCardPayload("l1", "Card", null, "top", null, null, List.of("lb1"),
				null);

		StepVerifier.create(this.cardService.createCard(payload)).expectNextCount(1).verifyComplete();

		verify(this.client).post("/cards", payload);
		assertThat(this.objectMapper.writeValueAsString(payload))
			.isEqualTo("{\"idList\":\"l1\",\"name\":\"Card\",\"pos\":\"top\",\"idLabels\":[\"lb1\"]}");
	}

	@Test
	void commentsUseCardActions() throws Exception {
		when(this.client.get(eq("/cards/c1/actions"), anyMap())).thenReturn(Mono.just(this.objectMapper.readTree("[]")));
		when(this.client.post(anyString(), any())).thenReturn(Mono.just(this.objectMapper.readTree("{}")));

		StepVerifier.create(this.cardService.getComments("c1")).expectNextCount(1).verifyComplete();
		StepVerifier.create(this.cardService.addComment("c1", "Looks good")).expectNextCount(1).verifyComplete();

		verify(this.client).get("/cards/c1/actions", Map.of("filter", "commentCard"));
		verify(this.client).post("/cards/c1/actions/comments", Map.of("text", "Looks good"));
	}

	@Test
	void membersAreAddedAndRemoved() throws Exception {
		when(this.client.post(anyString(), any())).thenReturn(Mono.just(this.objectMapper.readTree("[]")));
		when(this.client.delete(anyString())).thenReturn(Mono.just(NullNode.getInstance()));

		StepVerifier.create(this.cardService.addMember("c1", "m1")).expectNextCount(1).verifyComplete();
		StepVerifier.create(this.cardService.removeMember("c1", "m1")).expectNextCount(1).verifyComplete();

		verify(this.client).post("/cards/c1/idMembers", Map.of("value", "m1"));
		verify(this.client).delete("/cards/c1/idMembers/m1");
	}

	@Test
	void copyCardKeepsEverythingByDefault() throws Exception {
		CopyCardPayload payload = new CopyCardPayload("c1", "l2", null, null, null);

		assertThat(this.objectMapper.writeValueAsString(payload))
			.isEqualTo("{\"idCardSource\":\"c1\",\"idList\":\"l2\",\"keepFromSource\":\"all\"}");
	}

}
