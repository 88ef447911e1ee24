/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.trello.client;

/**
 * A Trello request that completed with a non-successful HTTP status, or that could not
 * be completed at all.
 */
public class TrelloApiException extends RuntimeException {

	private final int statusCode;

	private final String responseBody;

	public TrelloApiException(String method, String path, int statusCode, String responseBody) {
		super("Trello API " + method + " " + path + " failed with status " + statusCode
				+ (responseBody != null && !responseBody.isBlank() ? ": " + responseBody.strip() : ""));
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public TrelloApiException(String method, String path, Throwable cause) {
		super("Trello API " + method + " " + path + " failed: " + cause.getMessage(), cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	/**
	 * @return the HTTP status, or {@code -1} if no response was received
	 */
	public int getStatusCode() {
		return this.statusCode;
	}

	public String getResponseBody() {
		return this.responseBody;
	}

}
