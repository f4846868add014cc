package com.consullo.orchestrator.pty;

/**
 * Removes terminal escape sequences and stray control characters from PTY
 * text.
 *
 * <p>
 * Handles CSI ({@code ESC [ ... final}), OSC ({@code ESC ] ... BEL} or
 * {@code ESC ] ... ESC \}), two-character and intermediate escapes. State is
 * kept across calls, so a sequence split between two reads is still removed.
 * Newline, carriage return and tab pass through.
 * </p>
 */
final class AnsiStripper {

  private static final char ESC = 0x1B;
  private static final char BEL = 0x07;

  private enum State {
    TEXT,
    ESCAPE,
    INTERMEDIATE,
    CSI,
    OSC,
    OSC_ESCAPE
  }

  private State state = State.TEXT;

  String strip(final CharSequence input) {
    final StringBuilder out = new StringBuilder(input.length());
    for (int i = 0; i < input.length(); i++) {
      final char c = input.charAt(i);
      switch (state) {
        case TEXT:
          if (c == ESC) {
            state = State.ESCAPE;
          } else if (c == '\n' || c == '\r' || c == '\t' || (c >= 0x20 && c != 0x7F)) {
            out.append(c);
          }
          break;
        case ESCAPE:
          if (c == '[') {
            state = State.CSI;
          } else if (c == ']') {
            state = State.OSC;
          } else if (c >= 0x20 && c <= 0x2F) {
            state = State.INTERMEDIATE;
          } else {
            state = State.TEXT;
          }
          break;
        case INTERMEDIATE:
          if (c < 0x20 || c > 0x2F) {
            state = State.TEXT;
          }
          break;
        case CSI:
          if (c >= 0x40 && c <= 0x7E) {
            state = State.TEXT;
          }
          break;
        case OSC:
          if (c == BEL) {
            state = State.TEXT;
          } else if (c == ESC) {
            state = State.OSC_ESCAPE;
          }
          break;
        case OSC_ESCAPE:
          state = c == '\\' ? State.TEXT : State.OSC;
          break;
        default:
          state = State.TEXT;
      }
    }
    return out.toString();
  }

  void reset() {
    state = State.TEXT;
  }
}
