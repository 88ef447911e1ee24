/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.client;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.trello.TrelloConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TrelloClientTests {

	private final HttpClient httpClient = mock(HttpClient.class);

	@SuppressWarnings("unchecked")
	private final HttpResponse<String> httpResponse = mock(HttpResponse.class);

	private TrelloClient client;

	@BeforeEach
	void setUp() {
		TrelloConfig config = new TrelloConfig("my key", "my-token", "https://trello.test/1", Duration.ofSeconds(3));
		this.client = new TrelloClient(config, this.httpClient, new ObjectMapper());
		doReturn(CompletableFuture.completedFuture(this.httpResponse)).when(this.httpClient).sendAsync(any(), any());
	}

	@Test
	void sendsCredentialsAsEncodedQueryParameters() {
		respond(200, "{\"id\":\"b1\",\"name\":\"Board\"}");

		StepVerifier.create(this.client.get("/boards/b1", Map.of("fields", "name,url")))
			.assertNext(json -> assertThat(json.get("name").asText()).isEqualTo("Board"))
			.verifyComplete();

		HttpRequest request = sentRequest();
		assertThat(request.method()).isEqualTo("GET");
		assertThat(request.uri().getPath()).isEqualTo("/1/boards/b1");
		assertThat(request.uri().getRawQuery()).isEqualTo("fields=name%2Curl&key=my+key&token=my-token");
		assertThat(request.timeout()).contains(Duration.ofSeconds(3));
	}

	@Test
	void sendsJsonBodies() {
		respond(200, "{\"id\":\"c1\"}");

		StepVerifier.create(this.client.post("/cards", Map.of("name", "Card"))).expectNextCount(1).verifyComplete();

		HttpRequest request = sentRequest();
		assertThat(request.method()).isEqualTo("POST");
		assertThat(request.headers().firstValue("Content-Type")).hasValue("application/json");
		assertThat(request.bodyPublisher()).isPresent();
		assertThat(request.bodyPublisher().get().contentLength()).isEqualTo("{\"name\":\"Card\"}".length());
	}

	@Test
	void emptyBodiesBecomeNullNodes() {
		respond(200, "");

		StepVerifier.create(this.client.delete("/cards/c1"))
			.assertNext(json -> assertThat(json.isNull()).isTrue())
			.verifyComplete();
		assertThat(sentRequest().method()).isEqualTo("DELETE");
	}

	@Test
	void errorStatusesRaiseTrelloApiException() {
		respond(404, "The requested resource was not found.");

		StepVerifier.create(this.client.get("/cards/missing"))
			.expectErrorSatisfies(e -> {
				assertThat(e).isInstanceOf(TrelloApiException.class)
					.hasMessageContaining("404")
					.hasMessageContaining("/cards/missing")
					.hasMessageNotContaining("my-token");
				assertThat(((TrelloApiException) e).getStatusCode()).isEqualTo(404);
				assertThat(((TrelloApiException) e).getResponseBody()).contains("not found");
			})
			.verify();
	}

	@Test
	void transportFailuresRaiseTrelloApiException() {
		doReturn(CompletableFuture.failedFuture(new IOException("connection refused"))).when(this.httpClient)
			.sendAsync(any(), any());

		StepVerifier.create(this.client.get("/members/me"))
			.expectErrorSatisfies(e -> {
				assertThat(e).isInstanceOf(TrelloApiException.class).hasMessageContaining("connection refused");
				assertThat(((TrelloApiException) e).getStatusCode()).isEqualTo(-1);
			})
			.verify();
	}

	private void respond(int status, String body) {
		when(this.httpResponse.statusCode()).thenReturn(status);
		when(this.httpResponse.body()).thenReturn(body);
	}

	@SuppressWarnings("unchecked")
	private HttpRequest sentRequest() {
		ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
		verify(this.httpClient).sendAsync(captor.capture(), any(HttpResponse.BodyHandler.class));
		return captor.getValue();
	}

}
