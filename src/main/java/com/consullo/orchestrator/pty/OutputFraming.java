package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.stream.Message;
import com.consullo.orchestrator.stream.StreamDecoder;
import java.time.Clock;
import java.util.List;

/**
 * Turns raw PTY output into canonical messages for one session.
 *
 * <p>Driven from a single thread.
 *
 * @since 1.0
 */
interface OutputFraming {

  /**
   * Consumes a chunk of PTY output.
   *
   * @return messages completed by this chunk, in order
   */
  List<Message> accept(byte[] data, int length) throws Exception;

  /**
   * Called when no output arrived for a read tick.
   *
   * @return messages that became available through elapsed time
   */
  List<Message> onQuiet() throws Exception;

  /**
   * True when the CLI currently shows its input prompt.
   */
  boolean promptVisible() throws Exception;

  /**
   * Clears per-turn text before a new prompt is sent.
   */
  void beginTurn();

  String plainText();

  String detailedText();

  /**
   * External session id reported by the CLI, or null.
   */
  String sessionId();

  static OutputFraming create(
          final OutputMode mode,
          final int columns,
          final int rows,
          final int decoderBufferChars,
          final Clock clock) {
    switch (mode) {
      case JSON_EVENTS:
        return new JsonLineFraming(new StreamDecoder(decoderBufferChars, clock));
      case TERMINAL_TRANSCRIPT:
        return TerminalTranscriptFraming.create(columns, rows, clock);
      default:
        throw new IllegalArgumentException("Unsupported output mode: " + mode);
    }
  }
}
