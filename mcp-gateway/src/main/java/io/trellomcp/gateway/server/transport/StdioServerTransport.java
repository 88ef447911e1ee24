/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpToolDispatcher;
import io.trellomcp.gateway.server.auth.Role;
import io.trellomcp.gateway.server.auth.RoleContext;
import io.trellomcp.gateway.spec.DefaultMcpTransportContext;
import io.trellomcp.gateway.spec.McpSchema;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCMessage;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCNotification;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCRequest;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCResponse;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.trellomcp.gateway.spec.McpTransportContext;
import io.trellomcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Newline delimited JSON-RPC over standard input and output, for agent hosts that
 * launch the server as a child process.
 * <p>
 * The launching host is trusted: every message is dispatched with a
 * {@link Role#READ_WRITE} binding in its own transport context. Requests are handled
 * concurrently and each response is written as a single line. Nothing but JSON-RPC
 * messages is ever written to the output stream.
 */
public class StdioServerTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerTransport.class);

	private static final int MAX_CONCURRENT_REQUESTS = 16;

	private final McpToolDispatcher dispatcher;

	private final ObjectMapper objectMapper;

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final AtomicBoolean running = new AtomicBoolean(false);

	public StdioServerTransport(McpToolDispatcher dispatcher, ObjectMapper objectMapper) {
		this(dispatcher, objectMapper, System.in, System.out);
	}

	public StdioServerTransport(McpToolDispatcher dispatcher, ObjectMapper objectMapper, InputStream inputStream,
			OutputStream outputStream) {
		Assert.notNull(dispatcher, "The dispatcher can not be null");
		Assert.notNull(objectMapper, "The ObjectMapper can not be null");
		Assert.notNull(inputStream, "The InputStream can not be null");
		Assert.notNull(outputStream, "The OutputStream can not be null");
		this.dispatcher = dispatcher;
		this.objectMapper = objectMapper;
		this.inputStream = inputStream;
		this.outputStream = outputStream;
	}

	/**
	 * Reads messages until the input stream ends and waits for all in-flight requests.
	 * @throws IllegalStateException if the transport is already running
	 */
	public void run() {
		if (!this.running.compareAndSet(false, true)) {
			throw new IllegalStateException("Stdio transport is already running");
		}
		logger.info("Serving MCP over stdio");
		BufferedReader reader = new BufferedReader(new InputStreamReader(this.inputStream, StandardCharsets.UTF_8));
		try {
			Flux.fromStream(reader.lines())
				.subscribeOn(Schedulers.boundedElastic())
				.filter(line -> !line.isBlank())
				.flatMap(this::handleLine, MAX_CONCURRENT_REQUESTS)
				.doOnNext(this::write)
				.then()
				.block();
		}
		catch (UncheckedIOException e) {
			logger.error("Failed to read from stdin", e);
			throw e;
		}
		finally {
			this.running.set(false);
			logger.info("Stdin closed, stdio transport stopped");
		}
	}

	Mono<JSONRPCResponse> handleLine(String line) {
		JSONRPCMessage message;
		try {
			message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, line);
		}
		catch (IOException e) {
			logger.warn("Discarding unparseable input line: {}", e.getMessage());
			return Mono.just(JSONRPCResponse.failure(null,
					new JSONRPCError(McpSchema.ErrorCodes.PARSE_ERROR, "Parse error: invalid JSON", null)));
		}
		catch (IllegalArgumentException e) {
			logger.warn("Discarding invalid JSON-RPC message: {}", e.getMessage());
			return Mono.just(JSONRPCResponse.failure(null,
					new JSONRPCError(McpSchema.ErrorCodes.INVALID_REQUEST, "Invalid request: " + e.getMessage(), null)));
		}

		McpTransportContext transportContext = new DefaultMcpTransportContext();
		RoleContext.bind(transportContext, Role.READ_WRITE);
		if (message instanceof JSONRPCRequest request) {
			return this.dispatcher.handleRequest(transportContext, request);
		}
		if (message instanceof JSONRPCNotification notification) {
			return this.dispatcher.handleNotification(transportContext, notification).then(Mono.empty());
		}
		logger.debug("Ignoring client response {}", ((JSONRPCResponse) message).id());
		return Mono.empty();
	}

	private synchronized void write(JSONRPCResponse response) {
		try {
			byte[] json = this.objectMapper.writeValueAsBytes(response);
			this.outputStream.write(json);
			this.outputStream.write('\n');
			this.outputStream.flush();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write response to stdout", e);
		}
	}

}
