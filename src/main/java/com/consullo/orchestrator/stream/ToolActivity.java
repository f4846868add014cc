package com.consullo.orchestrator.stream;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One tool invocation requested by the agent, paired with its eventual result.
 *
 * <p>
 * Created when a tool-call event is decoded and completed at most once by the
 * matching tool-result event. A result that arrives for an unknown id produces
 * a result-only activity via {@link #resultOnly}.
 * </p>
 *
 * @since 1.0
 */
public final class ToolActivity {

  private static final Logger LOGGER = LoggerFactory.getLogger(ToolActivity.class);

  /** Name used for result-only activities whose call was never seen. */
  public static final String UNKNOWN_TOOL = "unknown";

  static final int RESULT_PREVIEW_LIMIT = 500;

  private final String id;
  private final String name;
  private final JsonNode input;
  private final Instant startedAt;

  private String resultText;
  private String fullResultText;
  private boolean error;
  private Long durationMs;
  private boolean completed;

  public ToolActivity(final String id, final String name, final JsonNode input, final Instant startedAt) {
    Validate.notNull(id, "id must not be null");
    Validate.notNull(name, "name must not be null");
    Validate.notNull(input, "input must not be null");
    Validate.notNull(startedAt, "startedAt must not be null");
    this.id = id;
    this.name = name;
    this.input = input;
    this.startedAt = startedAt;
  }

  /**
   * Creates an already-completed activity for a result whose call was never
   * observed.
   */
  public static ToolActivity resultOnly(
          final String id,
          final JsonNode emptyInput,
          final String output,
          final boolean isError,
          final Instant at) {
    final ToolActivity activity = new ToolActivity(id, UNKNOWN_TOOL, emptyInput, at);
    activity.complete(output, isError, at);
    return activity;
  }

  /**
   * Records the tool result.
   *
   * @param output raw result text (may be null)
   * @param isError true when the tool reported failure
   * @param completedAt completion time, used for the duration
   * @return false when the activity had already been completed (the second
   * result is ignored)
   */
  public boolean complete(final String output, final boolean isError, final Instant completedAt) {
    if (completed) {
      LOGGER.warn("Tool {} ({}) already completed; ignoring duplicate result", id, name);
      return false;
    }
    final String text = output != null ? output : "";
    this.fullResultText = text;
    this.resultText = preview(text, RESULT_PREVIEW_LIMIT);
    this.error = isError;
    if (completedAt != null) {
      this.durationMs = Math.max(0L, Duration.between(startedAt, completedAt).toMillis());
    }
    this.completed = true;
    return true;
  }

  static String preview(final String text, final int limit) {
    if (text.length() <= limit) {
      return text;
    }
    return text.substring(0, limit) + "...";
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public JsonNode input() {
    return input;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public String resultText() {
    return resultText;
  }

  public String fullResultText() {
    return fullResultText;
  }

  public boolean isError() {
    return error;
  }

  public Long durationMs() {
    return durationMs;
  }

  public boolean isCompleted() {
    return completed;
  }

  /**
   * Returns a string-valued input field, or null when absent or not textual.
   */
  public String inputText(final String field) {
    final JsonNode node = input.get(field);
    if (node == null || !node.isTextual()) {
      return null;
    }
    return node.asText();
  }

  @Override
  public String toString() {
    return "ToolActivity{id=" + id + ", name=" + name + ", completed=" + completed + ", error=" + error + "}";
  }
}
