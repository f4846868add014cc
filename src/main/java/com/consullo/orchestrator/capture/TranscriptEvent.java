package com.consullo.orchestrator.capture;

import java.time.Instant;

/**
 * One transcript line committed by the capture engine.
 */
public final class TranscriptEvent {

  public enum Source {
    /** Line scrolled off the screen. */
    SCROLLBACK,
    /** Screen row that stayed unchanged for the stability window. */
    SCREEN_STABLE
  }

  private final String text;
  private final Instant timestamp;
  private final Source source;

  private TranscriptEvent(String text, Instant timestamp, Source source) {
    this.text = text;
    this.timestamp = timestamp;
    this.source = source;
  }

  public static TranscriptEvent line(String text, Instant ts, Source src) {
    if (text == null || ts == null || src == null) {
      throw new IllegalArgumentException("text/ts/src must not be null.");
    }
    return new TranscriptEvent(text, ts, src);
  }

  /**
   * Line text without its terminator.
   */
  public String text() {
    return text;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public Source source() {
    return source;
  }

  @Override
  public String toString() {
    return source + ":" + text;
  }
}
