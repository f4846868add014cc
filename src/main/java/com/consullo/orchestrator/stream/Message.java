package com.consullo.orchestrator.stream;

import org.apache.commons.lang3.Validate;

/**
 * Canonical message decoded from a backend's output stream.
 *
 * <p>
 * Both wire formats, the JSON-RPC bridge and the PTY framings normalize into
 * these six kinds, so executors switch on {@link #kind()} instead of
 * re-parsing raw payloads.
 * </p>
 *
 * @since 1.0
 */
public interface Message {

  enum Kind {
    INIT,
    ASSISTANT,
    TOOL_CALL,
    TOOL_RESULT,
    RESULT,
    ERROR
  }

  Kind kind();

  /**
   * Returns true when this message ends the turn.
   */
  default boolean isFinal() {
    return false;
  }

  /**
   * Session announcement carrying the backend's external session id.
   *
   * @param sessionId external session id (opaque)
   */
  record Init(String sessionId) implements Message {

    @Override
    public Kind kind() {
      return Kind.INIT;
    }
  }

  /**
   * A chunk of assistant text.
   *
   * @param text text chunk
   */
  record Assistant(String text) implements Message {

    public Assistant {
      Validate.notNull(text, "text must not be null");
    }

    @Override
    public Kind kind() {
      return Kind.ASSISTANT;
    }
  }

  /**
   * A tool invocation requested by the agent.
   *
   * @param activity activity registered for the call
   */
  record ToolCall(ToolActivity activity) implements Message {

    public ToolCall {
      Validate.notNull(activity, "activity must not be null");
    }

    @Override
    public Kind kind() {
      return Kind.TOOL_CALL;
    }
  }

  /**
   * The outcome of a tool invocation.
   *
   * @param activity completed activity (result-only when the call was not
   * seen)
   */
  record ToolResult(ToolActivity activity) implements Message {

    public ToolResult {
      Validate.notNull(activity, "activity must not be null");
    }

    @Override
    public Kind kind() {
      return Kind.TOOL_RESULT;
    }
  }

  /**
   * Terminal turn summary.
   *
   * @param text accumulated plain text of the turn
   * @param detailedText accumulated text with tool activity rendered inline
   * @param costUnits reported cost, if any
   * @param durationMs reported duration, if any
   * @param sessionId external session id, if reported
   * @param error true when the backend flagged the turn as failed
   * @param errorText backend error description when {@code error} is set
   */
  record Result(
          String text,
          String detailedText,
          Double costUnits,
          Long durationMs,
          String sessionId,
          boolean error,
          String errorText) implements Message {

    @Override
    public Kind kind() {
      return Kind.RESULT;
    }

    @Override
    public boolean isFinal() {
      return true;
    }
  }

  /**
   * An error reported by the backend or synthesized by the decoder.
   *
   * @param text error description
   * @param terminal true when the error ends the turn
   */
  record Error(String text, boolean terminal) implements Message {

    public Error {
      Validate.notNull(text, "text must not be null");
    }

    @Override
    public Kind kind() {
      return Kind.ERROR;
    }

    @Override
    public boolean isFinal() {
      return terminal;
    }
  }
}
