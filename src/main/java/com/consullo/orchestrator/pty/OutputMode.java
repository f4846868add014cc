package com.consullo.orchestrator.pty;

/**
 * How a PTY session turns terminal output into messages.
 *
 * @since 1.0
 */
public enum OutputMode {
  /** The CLI prints one JSON event per line; escapes are stripped before decoding. */
  JSON_EVENTS,
  /** The CLI draws a full-screen UI; output is emulated and captured as transcript lines. */
  TERMINAL_TRANSCRIPT
}
