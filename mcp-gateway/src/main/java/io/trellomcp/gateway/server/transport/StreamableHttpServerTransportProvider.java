/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellomcp.gateway.server.McpToolDispatcher;
import io.trellomcp.gateway.server.McpTransportContextExtractor;
import io.trellomcp.gateway.server.session.McpSession;
import io.trellomcp.gateway.server.session.McpSessionStream;
import io.trellomcp.gateway.server.session.SessionLifecycleManager;
import io.trellomcp.gateway.server.session.SessionRegistry;
import io.trellomcp.gateway.spec.DefaultMcpTransportContext;
import io.trellomcp.gateway.spec.HttpHeaders;
import io.trellomcp.gateway.spec.McpSchema;
import io.trellomcp.gateway.spec.McpSchema.InitializeResult;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCMessage;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCNotification;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCRequest;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCResponse;
import io.trellomcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.trellomcp.gateway.spec.McpTransportContext;
import io.trellomcp.gateway.util.Assert;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Servlet implementing the MCP streamable HTTP transport on a single endpoint.
 * <ul>
 * <li>{@code POST} carries one JSON-RPC message or a batch. An {@code initialize}
 * request without {@code Mcp-Session-Id} opens a session; everything else requires a
 * known session. Responses are streamed as SSE when the client accepts
 * {@code text/event-stream}, otherwise returned as a JSON body.</li>
 * <li>{@code GET} opens the session's listening SSE stream.</li>
 * <li>{@code DELETE} terminates the session.</li>
 * </ul>
 * Every request gets a fresh {@link McpTransportContext}, filled by the configured
 * {@link McpTransportContextExtractor} and handed explicitly to the
 * {@link McpToolDispatcher}. While the session subsystem is unavailable every MCP
 * request is answered with {@code 503}.
 */
public class StreamableHttpServerTransportProvider extends HttpServlet {

	private static final long serialVersionUID = 1L;

	private static final Logger logger = LoggerFactory.getLogger(StreamableHttpServerTransportProvider.class);

	public static final String APPLICATION_JSON = "application/json";

	public static final String TEXT_EVENT_STREAM = "text/event-stream";

	public static final String MESSAGE_EVENT_TYPE = "message";

	public static final String UTF_8 = "UTF-8";

	private final transient ObjectMapper objectMapper;

	private final transient McpToolDispatcher dispatcher;

	private final transient SessionLifecycleManager lifecycleManager;

	private final transient McpTransportContextExtractor<HttpServletRequest> contextExtractor;

	private final boolean disallowDelete;

	private StreamableHttpServerTransportProvider(Builder builder) {
		this.objectMapper = builder.objectMapper;
		this.dispatcher = builder.dispatcher;
		this.lifecycleManager = builder.lifecycleManager;
		this.contextExtractor = builder.contextExtractor;
		this.disallowDelete = builder.disallowDelete;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	protected void service(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		if (!"OPTIONS".equalsIgnoreCase(request.getMethod()) && !this.lifecycleManager.isAvailable()) {
			logger.warn("Rejecting {} {}: session subsystem unavailable", request.getMethod(),
					request.getRequestURI());
			sendJsonError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE,
					new JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, "Session subsystem unavailable", null));
			return;
		}
		super.service(request, response);
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		SessionRegistry registry = registry();

		JsonNode body;
		try (InputStream inputStream = request.getInputStream()) {
			body = this.objectMapper.readTree(inputStream);
		}
		catch (JsonProcessingException e) {
			logger.debug("Unparseable request body: {}", e.getOriginalMessage());
			sendJsonError(response, HttpServletResponse.SC_BAD_REQUEST,
					new JSONRPCError(McpSchema.ErrorCodes.PARSE_ERROR, "Parse error: invalid JSON", null));
			return;
		}

		List<JSONRPCMessage> messages;
		try {
			messages = McpSchema.deserializeJsonRpcMessages(this.objectMapper, body);
		}
		catch (IllegalArgumentException e) {
			logger.debug("Invalid JSON-RPC message: {}", e.getMessage());
			sendJsonError(response, HttpServletResponse.SC_BAD_REQUEST,
					new JSONRPCError(McpSchema.ErrorCodes.INVALID_REQUEST, "Invalid request: " + e.getMessage(), null));
			return;
		}

		boolean initialize = messages.stream()
			.anyMatch(m -> m instanceof JSONRPCRequest r && McpSchema.METHOD_INITIALIZE.equals(r.method()));
		String sessionId = request.getHeader(HttpHeaders.MCP_SESSION_ID);

		McpSession session;
		if (initialize && sessionId == null) {
			if (messages.size() > 1) {
				sendJsonError(response, HttpServletResponse.SC_BAD_REQUEST, new JSONRPCError(
						McpSchema.ErrorCodes.INVALID_REQUEST, "Initialize request must not be batched", null));
				return;
			}
			session = registry.create();
			logger.info("Opened session {}", session.getId());
		}
		else {
			Optional<McpSession> existing = lookupSession(request, response, registry);
			if (existing.isEmpty()) {
				return;
			}
			session = existing.get();
		}
		response.setHeader(HttpHeaders.MCP_SESSION_ID, session.getId());

		McpTransportContext transportContext = this.contextExtractor.extract(request,
				new DefaultMcpTransportContext());

		List<JSONRPCRequest> requests = messages.stream()
			.filter(JSONRPCRequest.class::isInstance)
			.map(JSONRPCRequest.class::cast)
			.toList();
		Mono<Void> notifications = Flux.fromIterable(messages)
			.filter(JSONRPCNotification.class::isInstance)
			.cast(JSONRPCNotification.class)
			.concatMap(n -> this.dispatcher.handleNotification(transportContext, n))
			.then();

		if (requests.isEmpty()) {
			// only notifications and client responses
			notifications.block();
			response.setStatus(HttpServletResponse.SC_ACCEPTED);
			return;
		}

		Flux<JSONRPCResponse> responses = notifications
			.thenMany(Flux.fromIterable(requests)
				.flatMapSequential(r -> this.dispatcher.handleRequest(transportContext, r)))
			.doOnNext(r -> rememberProtocolVersion(session, r));

		String accept = request.getHeader(HttpHeaders.ACCEPT);
		if (accept != null && accept.contains(TEXT_EVENT_STREAM)) {
			streamResponses(request, response, session, responses);
		}
		else {
			writeJsonResponses(request, response, responses, body.isArray());
		}
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String accept = request.getHeader(HttpHeaders.ACCEPT);
		if (accept == null || !accept.contains(TEXT_EVENT_STREAM)) {
			response.setHeader("Allow", "POST, DELETE");
			sendJsonError(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, new JSONRPCError(
					McpSchema.ErrorCodes.INVALID_REQUEST, "GET requires Accept: " + TEXT_EVENT_STREAM, null));
			return;
		}
		Optional<McpSession> session = lookupSession(request, response, registry());
		if (session.isEmpty()) {
			return;
		}

		response.setHeader(HttpHeaders.MCP_SESSION_ID, session.get().getId());
		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(TEXT_EVENT_STREAM);
		response.setCharacterEncoding(UTF_8);

		AsyncContext asyncContext = request.startAsync(request, response);
		asyncContext.setTimeout(0);
		SseStream stream = new SseStream(asyncContext, response.getWriter(), session.get());
		asyncContext.addListener(stream);
		if (session.get().addStream(stream)) {
			response.flushBuffer();
			logger.debug("Opened listening stream for session {}", session.get().getId());
		}
	}

	@Override
	protected void doDelete(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		if (this.disallowDelete) {
			response.setHeader("Allow", "GET, POST");
			response.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
			return;
		}
		SessionRegistry registry = registry();
		Optional<McpSession> session = lookupSession(request, response, registry);
		if (session.isEmpty()) {
			return;
		}
		registry.remove(session.get().getId());
		logger.info("Session {} terminated by client", session.get().getId());
		response.setStatus(HttpServletResponse.SC_OK);
	}

	private void streamResponses(HttpServletRequest request, HttpServletResponse response, McpSession session,
			Flux<JSONRPCResponse> responses) throws IOException {
		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(TEXT_EVENT_STREAM);
		response.setCharacterEncoding(UTF_8);

		AsyncContext asyncContext = request.startAsync(request, response);
		asyncContext.setTimeout(0);
		SseStream stream = new SseStream(asyncContext, response.getWriter(), session);
		asyncContext.addListener(stream);
		if (!session.addStream(stream)) {
			logger.debug("Session {} closed before its response stream opened", session.getId());
			return;
		}
		response.flushBuffer();

		responses.subscribe(message -> {
			try {
				stream.sendEvent(MESSAGE_EVENT_TYPE, this.objectMapper.writeValueAsString(message));
			}
			catch (JsonProcessingException e) {
				logger.error("Failed to serialize response {}", message.id(), e);
			}
		}, e -> {
			logger.error("Response stream for session {} failed", session.getId(), e);
			stream.close();
		}, stream::close);
	}

	private void writeJsonResponses(HttpServletRequest request, HttpServletResponse response,
			Flux<JSONRPCResponse> responses, boolean batch) {
		AsyncContext asyncContext = request.startAsync(request, response);
		asyncContext.setTimeout(0);
		responses.collectList().subscribe(list -> {
			try {
				Object payload = batch ? list : list.get(0);
				response.setStatus(HttpServletResponse.SC_OK);
				response.setContentType(APPLICATION_JSON);
				response.setCharacterEncoding(UTF_8);
				response.getWriter().write(this.objectMapper.writeValueAsString(payload));
				response.getWriter().flush();
			}
			catch (IOException e) {
				logger.debug("Failed to write JSON response: {}", e.getMessage());
			}
			finally {
				asyncContext.complete();
			}
		}, e -> {
			logger.error("Failed to produce JSON response", e);
			try {
				response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
			}
			catch (IOException ioe) {
				logger.debug("Failed to send error response: {}", ioe.getMessage());
			}
			finally {
				asyncContext.complete();
			}
		});
	}

	private void rememberProtocolVersion(McpSession session, JSONRPCResponse response) {
		if (response.result() instanceof InitializeResult result) {
			session.setProtocolVersion(result.protocolVersion());
		}
	}

	/**
	 * Resolves the session named by {@code Mcp-Session-Id}. Once a session has negotiated
	 * a protocol version, a request carrying a different {@code MCP-Protocol-Version} is
	 * rejected with {@code 400}. On failure the error response has been written.
	 */
	private Optional<McpSession> lookupSession(HttpServletRequest request, HttpServletResponse response,
			SessionRegistry registry) throws IOException {
		String sessionId = request.getHeader(HttpHeaders.MCP_SESSION_ID);
		if (sessionId == null || sessionId.isBlank()) {
			sendJsonError(response, HttpServletResponse.SC_BAD_REQUEST, new JSONRPCError(
					McpSchema.ErrorCodes.INVALID_REQUEST, "Bad Request: Mcp-Session-Id header is required", null));
			return Optional.empty();
		}
		Optional<McpSession> session = registry.find(sessionId);
		if (session.isEmpty()) {
			logger.debug("Unknown session {}", sessionId);
			sendJsonError(response, HttpServletResponse.SC_NOT_FOUND,
					new JSONRPCError(McpSchema.ErrorCodes.INVALID_REQUEST, "Session not found: " + sessionId, null));
			return session;
		}
		String requested = request.getHeader(HttpHeaders.MCP_PROTOCOL_VERSION);
		String negotiated = session.get().getProtocolVersion();
		if (requested != null && negotiated != null && !requested.equals(negotiated)) {
			logger.debug("Session {} negotiated protocol {} but request sent {}", sessionId, negotiated, requested);
			sendJsonError(response, HttpServletResponse.SC_BAD_REQUEST,
					new JSONRPCError(McpSchema.ErrorCodes.INVALID_REQUEST,
							"Bad Request: Unsupported protocol version: " + requested, null));
			return Optional.empty();
		}
		return session;
	}

	private SessionRegistry registry() {
		return this.lifecycleManager.registry()
			.orElseThrow(() -> new IllegalStateException("Session subsystem unavailable"));
	}

	private void sendJsonError(HttpServletResponse response, int status, JSONRPCError error) throws IOException {
		response.setStatus(status);
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		response.getWriter().write(this.objectMapper.writeValueAsString(JSONRPCResponse.failure(null, error)));
		response.getWriter().flush();
	}

	/**
	 * An SSE stream bound to an {@link AsyncContext}. Writes are serialized; once the
	 * client disconnects the stream detaches itself from its session.
	 */
	static final class SseStream implements McpSessionStream, AsyncListener {

		private final AsyncContext asyncContext;

		private final PrintWriter writer;

		private final McpSession session;

		private final AtomicBoolean closed = new AtomicBoolean(false);

		SseStream(AsyncContext asyncContext, PrintWriter writer, McpSession session) {
			this.asyncContext = asyncContext;
			this.writer = writer;
			this.session = session;
		}

		synchronized boolean sendEvent(String eventType, String data) {
			if (this.closed.get()) {
				return false;
			}
			this.writer.write("event: " + eventType + "\n");
			this.writer.write("data: " + data + "\n\n");
			return flush();
		}

		@Override
		public synchronized boolean sendKeepAlive() {
			if (this.closed.get()) {
				return false;
			}
			this.writer.write(": keep-alive\n\n");
			return flush();
		}

		private boolean flush() {
			this.writer.flush();
			if (this.writer.checkError()) {
				logger.debug("Client of session {} disconnected", this.session.getId());
				close();
				return false;
			}
			return true;
		}

		@Override
		public void close() {
			if (!this.closed.compareAndSet(false, true)) {
				return;
			}
			this.session.removeStream(this);
			try {
				this.asyncContext.complete();
			}
			catch (IllegalStateException e) {
				logger.debug("Stream of session {} already completed: {}", this.session.getId(), e.getMessage());
			}
		}

		@Override
		public void onComplete(AsyncEvent event) {
			this.closed.set(true);
			this.session.removeStream(this);
		}

		@Override
		public void onTimeout(AsyncEvent event) {
			close();
		}

		@Override
		public void onError(AsyncEvent event) {
			logger.debug("Stream of session {} failed: {}", this.session.getId(),
					event.getThrowable() != null ? event.getThrowable().getMessage() : "unknown");
			close();
		}

		@Override
		public void onStartAsync(AsyncEvent event) {
		}

	}

	public static class Builder {

		private ObjectMapper objectMapper = new ObjectMapper();

		private McpToolDispatcher dispatcher;

		private SessionLifecycleManager lifecycleManager;

		private McpTransportContextExtractor<HttpServletRequest> contextExtractor = McpTransportContextExtractor
			.roleBinding();

		private boolean disallowDelete;

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder dispatcher(McpToolDispatcher dispatcher) {
			this.dispatcher = dispatcher;
			return this;
		}

		public Builder lifecycleManager(SessionLifecycleManager lifecycleManager) {
			this.lifecycleManager = lifecycleManager;
			return this;
		}

		public Builder contextExtractor(McpTransportContextExtractor<HttpServletRequest> contextExtractor) {
			Assert.notNull(contextExtractor, "contextExtractor must not be null");
			this.contextExtractor = contextExtractor;
			return this;
		}

		public Builder disallowDelete(boolean disallowDelete) {
			this.disallowDelete = disallowDelete;
			return this;
		}

		public StreamableHttpServerTransportProvider build() {
			Assert.notNull(this.dispatcher, "Dispatcher must not be null");
			Assert.notNull(this.lifecycleManager, "Lifecycle manager must not be null");
			return new StreamableHttpServerTransportProvider(this);
		}

	}

}
