package com.consullo.orchestrator.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts raw backend output lines into canonical {@link Message}s.
 *
 * <p>
 * Two wire shapes are understood:
 * <ul>
 * <li>the discrete-message variant ({@code system}, {@code assistant},
 * {@code user}, {@code result}, {@code error}) with typed content blocks;</li>
 * <li>the item/event variant ({@code session_start}, {@code message},
 * {@code tool_call}, {@code tool_result}, {@code done}) together with the
 * dotted lifecycle events ({@code thread.started}, {@code item.completed},
 * {@code turn.completed}, ...).</li>
 * </ul>
 * </p>
 *
 * <p>
 * Incomplete JSON is buffered across lines up to a fixed cap. {@link #feed}
 * never throws. Instances are not thread-safe; one decoder serves one output
 * stream.
 * </p>
 *
 * @since 1.0
 */
public final class StreamDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamDecoder.class);

  /** Default cap on buffered fragment characters. */
  public static final int DEFAULT_MAX_BUFFER_CHARS = 1024 * 1024;

  private static final Set<String> FAILED_ITEM_STATUSES = Set.of("failed", "error", "cancelled");

  private final ObjectMapper mapper;
  private final Clock clock;
  private final int maxBufferChars;

  private final StringBuilder buffer = new StringBuilder();
  private final Map<String, ToolActivity> pendingTools = new HashMap<>();
  private final TextAccumulator text = new TextAccumulator();

  private String sessionId;

  public StreamDecoder() {
    this(DEFAULT_MAX_BUFFER_CHARS, Clock.systemUTC());
  }

  public StreamDecoder(final int maxBufferChars, final Clock clock) {
    Validate.isTrue(maxBufferChars > 0, "maxBufferChars must be positive");
    Validate.notNull(clock, "clock must not be null");
    this.maxBufferChars = maxBufferChars;
    this.clock = clock;
    this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Decodes one output line.
   *
   * @param line raw line without its terminator (may be null)
   * @return decoded messages in order; empty when the line produced nothing
   */
  public List<Message> feed(final String line) {
    if (line == null) {
      return List.of();
    }
    final String trimmed = line.strip();
    if (trimmed.isEmpty()) {
      return List.of();
    }

    JsonNode node = tryParse(trimmed);
    if (node != null) {
      if (buffer.length() > 0) {
        LOGGER.debug("Discarding {} buffered chars superseded by a complete line", buffer.length());
        buffer.setLength(0);
      }
    } else {
      buffer.append(trimmed);
      if (buffer.length() > maxBufferChars) {
        final int size = buffer.length();
        buffer.setLength(0);
        LOGGER.warn("Stream buffer overflow at {} chars; buffer reset", size);
        return List.of(overflowError());
      }
      if (buffer.length() == trimmed.length()) {
        return List.of();
      }
      node = tryParse(buffer.toString());
      if (node == null) {
        return List.of();
      }
      buffer.setLength(0);
    }

    try {
      return dispatch(node);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to interpret stream event: {}", e.getMessage(), e);
      return List.of();
    }
  }

  /**
   * Clears the accumulated turn text, keeping the session id and pending tool
   * registrations.
   */
  public void beginTurn() {
    text.clear();
  }

  /**
   * Clears all decoder state.
   */
  public void reset() {
    buffer.setLength(0);
    pendingTools.clear();
    text.clear();
    sessionId = null;
  }

  public String plainText() {
    return text.plainText();
  }

  public String detailedText() {
    return text.detailedText();
  }

  public String sessionId() {
    return sessionId;
  }

  public int bufferedChars() {
    return buffer.length();
  }

  public int maxBufferChars() {
    return maxBufferChars;
  }

  /**
   * The non-final error reported when a chunk outgrows the buffer cap.
   */
  public Message.Error overflowError() {
    return new Message.Error(
            "Stream buffer overflow: JSON chunk exceeded " + (maxBufferChars / 1024) + "KB limit", false);
  }

  public int pendingToolCount() {
    return pendingTools.size();
  }

  private JsonNode tryParse(final String candidate) {
    try {
      return mapper.readTree(candidate);
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private List<Message> dispatch(final JsonNode node) {
    if (!node.isObject()) {
      final String value = node.isTextual() ? node.asText() : node.toString();
      text.appendAssistant(value);
      return List.of(new Message.Assistant(value));
    }

    final String type = node.path("type").asText("");
    switch (type) {
      case "system":
      case "session_start":
        return init(firstText(node, "session_id", "sessionId"));
      case "thread.started":
        return init(firstText(node, "thread_id", "threadId"));
      case "assistant":
        if (node.path("message").isObject()) {
          return assistantBlocks(node.path("message").path("content"));
        }
        return assistantText(firstText(node, "content", "text"));
      case "message":
        return assistantText(firstText(node, "content", "text"));
      case "user":
        return userBlocks(node.path("message").path("content"));
      case "tool_call":
        return List.of(registerCall(
                node.path("id").asText("unknown"),
                node.path("name").asText("unknown"),
                node.get("input")));
      case "request_user_input":
        return requestUserInput(node);
      case "tool_result":
        return List.of(completeResult(
                firstText(node, "tool_use_id", "id"),
                resultContent(firstPresent(node, "content", "output", "result")),
                flag(firstPresent(node, "is_error", "error"))));
      case "item.started":
        return itemStarted(node.path("item"));
      case "item.completed":
        return itemCompleted(node.path("item"));
      case "result":
      case "done":
      case "turn.completed":
        return List.of(result(node));
      case "turn.failed":
        return List.of(new Message.Error(errorMessage(node.get("error"), "Codex turn failed"), true));
      case "error":
        return List.of(new Message.Error(
                errorMessage(node.has("error") ? node.get("error") : node.get("message"), "Unknown error"), true));
      default:
        LOGGER.debug("Ignoring stream event of type '{}'", type);
        return List.of();
    }
  }

  private List<Message> init(final String id) {
    if (id != null && !id.isEmpty()) {
      sessionId = id;
    }
    return List.of(new Message.Init(sessionId));
  }

  private List<Message> assistantText(final String chunk) {
    if (chunk == null || chunk.isEmpty()) {
      return List.of();
    }
    text.appendAssistant(chunk);
    return List.of(new Message.Assistant(chunk));
  }

  private List<Message> assistantBlocks(final JsonNode content) {
    if (content.isTextual()) {
      return assistantText(content.asText());
    }
    final List<Message> out = new ArrayList<>();
    for (JsonNode block : content) {
      final String blockType = block.path("type").asText("");
      if ("text".equals(blockType)) {
        out.addAll(assistantText(block.path("text").asText("")));
      } else if ("tool_use".equals(blockType)) {
        out.add(registerCall(
                block.path("id").asText("unknown"),
                block.path("name").asText("unknown"),
                block.get("input")));
      }
    }
    return out;
  }

  private List<Message> userBlocks(final JsonNode content) {
    final List<Message> out = new ArrayList<>();
    for (JsonNode block : content) {
      if ("tool_result".equals(block.path("type").asText(""))) {
        out.add(completeResult(
                block.path("tool_use_id").asText(null),
                resultContent(block.get("content")),
                flag(block.get("is_error"))));
      }
    }
    return out;
  }

  private List<Message> requestUserInput(final JsonNode node) {
    final ObjectNode input = mapper.createObjectNode();
    input.set("questions", node.has("questions") ? node.get("questions") : mapper.createArrayNode());
    return List.of(registerCall(firstText(node, "call_id", "id"), "request_user_input", input));
  }

  private List<Message> itemStarted(final JsonNode item) {
    if (!"command_execution".equals(item.path("type").asText(""))) {
      return List.of();
    }
    final ObjectNode input = mapper.createObjectNode();
    input.put("command", item.path("command").asText(""));
    return List.of(registerCall(item.path("id").asText("unknown"), "run_command", input));
  }

  private List<Message> itemCompleted(final JsonNode item) {
    final String itemType = item.path("type").asText("");
    if ("agent_message".equals(itemType)) {
      return assistantText(item.path("text").asText(""));
    }
    if (!"command_execution".equals(itemType)) {
      return List.of();
    }
    final JsonNode exitCode = item.get("exit_code");
    final JsonNode itemError = item.get("error");
    final boolean hasError = itemError != null && !itemError.isNull()
            && !(itemError.isBoolean() && !itemError.asBoolean())
            && !(itemError.isTextual() && itemError.asText().isEmpty());
    final boolean isError = (exitCode != null && !exitCode.isNull() && exitCode.asInt(1) != 0)
            || FAILED_ITEM_STATUSES.contains(item.path("status").asText("").toLowerCase(Locale.ROOT))
            || hasError;

    String output = resultContent(firstPresent(item, "aggregated_output", "output"));
    if (output.isEmpty() && hasError) {
      output = errorMessage(itemError, "");
    }
    return List.of(completeResult(item.path("id").asText("unknown"), output, isError));
  }

  private Message result(final JsonNode node) {
    final boolean failed = flag(node.get("is_error"));
    String errorText = null;
    if (failed) {
      final JsonNode errors = node.path("errors");
      if (errors.isArray() && errors.size() > 0) {
        final List<String> parts = new ArrayList<>();
        for (JsonNode e : errors) {
          parts.add(e.isTextual() ? e.asText() : e.toString());
        }
        errorText = String.join("; ", parts);
      } else {
        errorText = node.path("result").asText("Unknown error");
      }
    }

    final String reportedId = firstText(node, "session_id", "thread_id");
    if (reportedId != null && !reportedId.isEmpty()) {
      sessionId = reportedId;
    }

    final String resultField = node.path("result").isTextual() ? node.path("result").asText() : null;
    final String plain = text.plainText().isEmpty() && resultField != null && !failed
            ? resultField
            : text.plainText();

    if (!pendingTools.isEmpty()) {
      LOGGER.debug("Clearing {} unmatched tool registrations at end of turn", pendingTools.size());
      pendingTools.clear();
    }

    return new Message.Result(
            plain,
            text.detailedText().isEmpty() ? plain : text.detailedText(),
            number(firstPresent(node, "total_cost_usd", "cost_usd"), node.path("usage").get("cost")),
            longNumber(firstPresent(node, "duration_ms", "duration")),
            sessionId,
            failed,
            errorText);
  }

  private Message registerCall(final String id, final String name, final JsonNode rawInput) {
    final String toolId = id != null ? id : "unknown";
    final ToolActivity activity = new ToolActivity(toolId, name, normalizeInput(rawInput), clock.instant());
    final ToolActivity previous = pendingTools.put(toolId, activity);
    if (previous != null) {
      LOGGER.warn("Tool id collision for {}: replacing pending {} with {}", toolId, previous.name(), name);
    }
    text.appendToolCall(activity);
    return new Message.ToolCall(activity);
  }

  private Message completeResult(final String id, final String output, final boolean isError) {
    final String toolId = id != null ? id : "unknown";
    ToolActivity activity = pendingTools.remove(toolId);
    if (activity == null) {
      LOGGER.debug("Tool result for untracked id {}", toolId);
      activity = ToolActivity.resultOnly(toolId, mapper.createObjectNode(), output, isError, clock.instant());
    } else {
      activity.complete(output, isError, clock.instant());
    }
    text.appendToolResult(activity);
    return new Message.ToolResult(activity);
  }

  /**
   * Tool input as a JSON object: strings are parsed, other values are wrapped
   * under {@code raw}.
   */
  JsonNode normalizeInput(final JsonNode raw) {
    if (raw == null || raw.isNull() || raw.isMissingNode()) {
      return mapper.createObjectNode();
    }
    if (raw.isObject()) {
      return raw;
    }
    if (raw.isTextual()) {
      final JsonNode parsed = tryParse(raw.asText());
      if (parsed != null && parsed.isObject()) {
        return parsed;
      }
    }
    final ObjectNode wrapped = mapper.createObjectNode();
    wrapped.set("raw", raw);
    return wrapped;
  }

  private static String resultContent(final JsonNode content) {
    if (content == null || content.isNull() || content.isMissingNode()) {
      return "";
    }
    if (content.isTextual()) {
      return content.asText();
    }
    if (content.isArray()) {
      final StringBuilder sb = new StringBuilder();
      for (JsonNode part : content) {
        if (part.isTextual()) {
          sb.append(part.asText());
        } else if ("text".equals(part.path("type").asText(""))) {
          sb.append(part.path("text").asText(""));
        }
      }
      return sb.toString();
    }
    return content.toString();
  }

  private static String errorMessage(final JsonNode error, final String fallback) {
    if (error == null || error.isNull() || error.isMissingNode()) {
      return fallback;
    }
    if (error.isTextual()) {
      return error.asText().isEmpty() ? fallback : error.asText();
    }
    final JsonNode message = error.get("message");
    if (message != null && message.isTextual() && !message.asText().isEmpty()) {
      return message.asText();
    }
    return error.toString();
  }

  private static boolean flag(final JsonNode node) {
    if (node == null || node.isNull()) {
      return false;
    }
    if (node.isTextual()) {
      return "true".equalsIgnoreCase(node.asText());
    }
    return node.asBoolean(false);
  }

  private static Double number(final JsonNode primary, final JsonNode fallback) {
    final JsonNode n = primary != null && primary.isNumber() ? primary : fallback;
    return n != null && n.isNumber() ? n.asDouble() : null;
  }

  private static Long longNumber(final JsonNode n) {
    return n != null && n.isNumber() ? n.asLong() : null;
  }

  private static JsonNode firstPresent(final JsonNode node, final String... fields) {
    for (String field : fields) {
      final JsonNode value = node.get(field);
      if (value != null && !value.isNull()) {
        return value;
      }
    }
    return null;
  }

  private static String firstText(final JsonNode node, final String... fields) {
    final JsonNode value = firstPresent(node, fields);
    if (value == null) {
      return null;
    }
    return value.isTextual() ? value.asText() : value.toString();
  }
}
