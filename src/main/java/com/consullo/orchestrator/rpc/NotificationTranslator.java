package com.consullo.orchestrator.rpc;

import com.consullo.orchestrator.stream.Message;
import com.consullo.orchestrator.stream.StreamDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites app-server notifications as item/event stream lines and feeds them
 * through a {@link StreamDecoder}, so RPC turns produce the same messages as
 * the one-shot CLI.
 *
 * @since 1.0
 */
final class NotificationTranslator {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationTranslator.class);

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final StreamDecoder decoder;
  private final Consumer<Message> sink;
  private final Map<String, StringBuilder> agentDeltas = new HashMap<>();

  private String threadId;

  NotificationTranslator(final StreamDecoder decoder, final Consumer<Message> sink) {
    this.decoder = decoder;
    this.sink = sink;
  }

  /**
   * Emits {@code Init} for the thread the turn runs on.
   */
  void threadStarted(final String id) {
    if (id == null || id.isEmpty() || id.equals(threadId)) {
      return;
    }
    threadId = id;
    final ObjectNode event = NODES.objectNode();
    event.put("type", "thread.started");
    event.put("thread_id", id);
    emit(event);
  }

  /**
   * Emits a {@code request_user_input} tool call.
   */
  void userInputRequested(final String itemId, final JsonNode questions) {
    final ObjectNode event = NODES.objectNode();
    event.put("type", "request_user_input");
    event.put("call_id", itemId);
    event.set("questions", questions != null ? questions : NODES.arrayNode());
    emit(event);
  }

  /**
   * Emits the answer of a {@code request_user_input} call as its tool result.
   */
  void userInputAnswered(final String itemId, final JsonNode answer) {
    final ObjectNode event = NODES.objectNode();
    event.put("type", "tool_result");
    event.put("tool_use_id", itemId);
    event.put("content", answer.toString());
    emit(event);
  }

  /**
   * Translates one notification.
   *
   * @return the final message when the notification ended the turn, else null
   */
  Message onNotification(final JsonNode notification) {
    final String method = notification.path("method").asText("");
    final JsonNode params = notification.path("params");
    switch (method) {
      case "thread/started":
        threadStarted(params.path("thread").path("id").asText(params.path("threadId").asText("")));
        return null;
      case "item/agentMessage/delta":
        agentDeltas.computeIfAbsent(params.path("itemId").asText(""), k -> new StringBuilder())
                .append(params.path("delta").asText(""));
        return null;
      case "item/started":
        itemStarted(params.path("item"));
        return null;
      case "item/completed":
        itemCompleted(params.path("item"));
        return null;
      case "turn/completed":
        return turnCompleted(params.path("turn"));
      case "turn/failed":
        return failed(params.path("turn").path("error"), "Codex turn failed");
      case "error":
        if (params.path("willRetry").asBoolean(false)) {
          LOGGER.info("app-server reported a retryable error: {}", params.path("error").path("message").asText(""));
          return null;
        }
        return failed(params.path("error"), "Unknown error");
      default:
        LOGGER.debug("Ignoring notification {}", method);
        return null;
    }
  }

  private void itemStarted(final JsonNode item) {
    final String type = item.path("type").asText("");
    final String id = item.path("id").asText("unknown");
    if ("agentMessage".equals(type) || "userMessage".equals(type) || "reasoning".equals(type)) {
      return;
    }
    final ObjectNode event = NODES.objectNode();
    if ("commandExecution".equals(type)) {
      event.put("type", "item.started");
      final ObjectNode translated = event.putObject("item");
      translated.put("id", id);
      translated.put("type", "command_execution");
      translated.put("command", item.path("command").asText(""));
    } else {
      event.put("type", "tool_call");
      event.put("id", id);
      event.put("name", type.isEmpty() ? "unknown" : type);
      event.set("input", item);
    }
    emit(event);
  }

  private void itemCompleted(final JsonNode item) {
    final String type = item.path("type").asText("");
    final String id = item.path("id").asText("unknown");
    if ("agentMessage".equals(type)) {
      final StringBuilder deltas = agentDeltas.remove(id);
      String text = item.path("text").asText("");
      if (text.isEmpty() && deltas != null) {
        text = deltas.toString();
      }
      final ObjectNode event = NODES.objectNode();
      event.put("type", "item.completed");
      final ObjectNode translated = event.putObject("item");
      translated.put("id", id);
      translated.put("type", "agent_message");
      translated.put("text", text);
      emit(event);
      return;
    }
    if ("userMessage".equals(type) || "reasoning".equals(type)) {
      return;
    }
    if ("commandExecution".equals(type)) {
      final ObjectNode event = NODES.objectNode();
      event.put("type", "item.completed");
      final ObjectNode translated = event.putObject("item");
      translated.put("id", id);
      translated.put("type", "command_execution");
      translated.put("aggregated_output", item.path("aggregatedOutput").asText(""));
      if (item.hasNonNull("exitCode")) {
        translated.put("exit_code", item.get("exitCode").asInt());
      }
      translated.put("status", item.path("status").asText(""));
      emit(event);
      return;
    }
    final String status = item.path("status").asText("");
    final ObjectNode event = NODES.objectNode();
    event.put("type", "tool_result");
    event.put("tool_use_id", id);
    event.put("content", item.has("output") ? item.path("output").asText("") : status);
    event.put("is_error", "failed".equalsIgnoreCase(status) || "declined".equalsIgnoreCase(status));
    emit(event);
  }

  private Message turnCompleted(final JsonNode turn) {
    final String status = turn.path("status").asText("completed");
    if (!"completed".equals(status)) {
      return failed(turn.path("error"), "Turn " + status);
    }
    final ObjectNode event = NODES.objectNode();
    event.put("type", "done");
    if (threadId != null) {
      event.put("thread_id", threadId);
    }
    return emit(event);
  }

  private Message failed(final JsonNode error, final String fallback) {
    final ObjectNode event = NODES.objectNode();
    event.put("type", "turn.failed");
    if (error != null && !error.isMissingNode() && !error.isNull()) {
      event.set("error", error);
    } else {
      event.put("error", fallback);
    }
    return emit(event);
  }

  /**
   * Feeds one synthesized line and forwards its messages.
   *
   * @return the last final message produced, or null
   */
  private Message emit(final ObjectNode event) {
    final List<Message> messages = decoder.feed(event.toString());
    Message terminal = null;
    for (Message message : messages) {
      sink.accept(message);
      if (message.isFinal()) {
        terminal = message;
      }
    }
    return terminal;
  }
}
