package com.consullo.orchestrator.rpc;

import com.consullo.orchestrator.config.ExecutionTimeouts;
import com.consullo.orchestrator.exec.LineChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Newline-delimited JSON-RPC 2.0 connection over a child process's stdio.
 *
 * <p>
 * Request ids increase monotonically from 1. While a call waits for its
 * response, responses to other ids are cached, notifications are queued for
 * {@link #nextNotification()} and server requests are answered immediately
 * through the {@link ServerRequestHandler}.
 * </p>
 *
 * <p>Used by a single thread; only {@link #cancel()} may be called from others.
 *
 * @since 1.0
 */
final class RpcChannel implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RpcChannel.class);

  /**
   * Answers a server-initiated request.
   */
  @FunctionalInterface
  interface ServerRequestHandler {

    /**
     * @return result object for the response
     * @throws RpcException to send an error response with the exception's code
     */
    JsonNode handle(String method, JsonNode params) throws RpcException;
  }

  private final ObjectMapper mapper;
  private final OutputStream stdin;
  private final LineChannel stdout;
  private final ExecutionTimeouts timeouts;
  private final Clock clock;
  private final ServerRequestHandler handler;

  private final Map<Long, JsonNode> cachedResponses = new HashMap<>();
  private final Deque<JsonNode> queuedNotifications = new ArrayDeque<>();
  private long nextId = 1L;
  private Instant lastLineAt;
  private volatile boolean cancelled;

  RpcChannel(
          final Process process,
          final ObjectMapper mapper,
          final ExecutionTimeouts timeouts,
          final Clock clock,
          final String name,
          final ServerRequestHandler handler) {
    this.mapper = mapper;
    this.stdin = process.getOutputStream();
    this.stdout = LineChannel.start(process.getInputStream(), name + "-stdout");
    this.timeouts = timeouts;
    this.clock = clock;
    this.handler = handler;
    this.lastLineAt = clock.instant();
  }

  /**
   * Sends a request and waits for its response.
   *
   * @return the response's {@code result}
   * @throws RpcException on an error response, a closed channel or a read
   * timeout
   * @throws CancellationException when {@link #cancel()} was called
   */
  JsonNode call(final String method, final JsonNode params) throws RpcException {
    final long id = nextId++;
    write(JsonRpcMessage.Request.create(id, method, params));
    LOGGER.debug("-> {} (id {})", method, id);

    while (true) {
      final JsonNode cached = cachedResponses.remove(id);
      if (cached != null) {
        return unwrap(method, cached);
      }
      final JsonNode message = readMessage();
      if (message == null) {
        throw new RpcException("app-server closed the connection before answering " + method);
      }
      switch (JsonRpcMessage.classify(message)) {
        case RESPONSE:
          final long responseId = message.path("id").asLong(-1L);
          if (responseId == id) {
            return unwrap(method, message);
          }
          LOGGER.debug("Caching out-of-order response {} while waiting for {}", responseId, id);
          cachedResponses.put(responseId, message);
          break;
        case REQUEST:
          answer(message);
          break;
        case NOTIFICATION:
          queuedNotifications.addLast(message);
          break;
        default:
          LOGGER.debug("Ignoring malformed JSON-RPC message: {}", message);
      }
    }
  }

  /**
   * Sends a notification.
   */
  void notify(final String method, final JsonNode params) throws RpcException {
    write(JsonRpcMessage.Notification.create(method, params));
  }

  /**
   * Returns the next notification, answering server requests on the way.
   *
   * @return next notification, or null when the server closed its output
   * @throws RpcException on a read timeout
   * @throws CancellationException when {@link #cancel()} was called
   */
  JsonNode nextNotification() throws RpcException {
    if (!queuedNotifications.isEmpty()) {
      return queuedNotifications.pollFirst();
    }
    while (true) {
      final JsonNode message = readMessage();
      if (message == null) {
        return null;
      }
      switch (JsonRpcMessage.classify(message)) {
        case NOTIFICATION:
          return message;
        case REQUEST:
          answer(message);
          break;
        case RESPONSE:
          LOGGER.debug("Ignoring late response {}", message.path("id"));
          break;
        default:
          LOGGER.debug("Ignoring malformed JSON-RPC message: {}", message);
      }
    }
  }

  void cancel() {
    cancelled = true;
  }

  @Override
  public void close() {
    try {
      stdin.close();
    } catch (IOException e) {
      LOGGER.debug("Closing app-server stdin failed: {}", e.getMessage());
    }
  }

  private JsonNode readMessage() throws RpcException {
    while (true) {
      checkCancelled();
      final LineChannel.Line line;
      try {
        line = stdout.poll(timeouts.pollTick());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelled = true;
        throw new CancellationException("Interrupted while waiting for app-server output");
      }
      final Instant now = clock.instant();
      if (line == null) {
        if (Duration.between(lastLineAt, now).compareTo(timeouts.readTimeout()) >= 0) {
          throw new RpcException("No output from app-server for " + timeouts.readTimeout().toSeconds() + "s");
        }
        continue;
      }
      checkCancelled();
      if (line.endOfStream()) {
        return null;
      }
      lastLineAt = now;
      final String text = line.text().strip();
      if (text.isEmpty()) {
        continue;
      }
      try {
        return mapper.readTree(text);
      } catch (JsonProcessingException e) {
        LOGGER.debug("Skipping non-JSON app-server line: {}", text);
      }
    }
  }

  private void answer(final JsonNode request) throws RpcException {
    final String method = request.path("method").asText("");
    final JsonNode id = request.get("id");
    final JsonNode params = request.has("params") ? request.get("params") : mapper.createObjectNode();
    LOGGER.debug("<- server request {} (id {})", method, id);
    JsonRpcMessage.Response response;
    try {
      response = JsonRpcMessage.Response.success(id, handler.handle(method, params));
    } catch (RpcException e) {
      final int code = e.getCode() != null ? e.getCode() : JsonRpcMessage.INTERNAL_ERROR;
      response = JsonRpcMessage.Response.error(id, code, e.getMessage());
    }
    write(response);
  }

  private JsonNode unwrap(final String method, final JsonNode response) throws RpcException {
    final JsonNode error = response.get("error");
    if (error != null && !error.isNull()) {
      final String message = error.path("message").asText(error.toString());
      final Integer code = error.has("code") ? error.get("code").asInt() : null;
      throw new RpcException(method + " failed: " + message, code);
    }
    final JsonNode result = response.get("result");
    return result != null ? result : mapper.createObjectNode();
  }

  private void checkCancelled() {
    if (cancelled) {
      throw new CancellationException("RPC session cancelled");
    }
  }

  private void write(final Object message) throws RpcException {
    try {
      final byte[] bytes = (mapper.writeValueAsString(message) + "\n").getBytes(StandardCharsets.UTF_8);
      stdin.write(bytes);
      stdin.flush();
    } catch (IOException e) {
      throw new RpcException("Failed writing to app-server: " + e.getMessage(), e);
    }
  }
}
