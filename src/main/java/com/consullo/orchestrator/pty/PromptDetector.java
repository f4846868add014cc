package com.consullo.orchestrator.pty;

/**
 * Recognizes the input prompt interactive agent CLIs print when they wait for
 * the next message.
 *
 * <p>
 * After trimming blanks and box edges a prompt line is either a bare marker
 * ({@code >} or {@code ❯}), text ending in a marker ({@code codex>}), or a
 * marker followed by a space and placeholder text inside an input box.
 * </p>
 */
final class PromptDetector {

  private PromptDetector() {
  }

  static boolean isPrompt(final String line) {
    if (line == null) {
      return false;
    }
    int start = 0;
    int end = line.length();
    while (start < end && isFrame(line.charAt(start))) {
      start++;
    }
    while (end > start && isFrame(line.charAt(end - 1))) {
      end--;
    }
    if (start == end) {
      return false;
    }
    if (isMarker(line.charAt(end - 1))) {
      return true;
    }
    return end - start >= 2 && isMarker(line.charAt(start)) && line.charAt(start + 1) == ' ';
  }

  private static boolean isMarker(final char c) {
    return c == '>' || c == '❯';
  }

  private static boolean isFrame(final char c) {
    return c == ' ' || c == '\t' || c == '\0' || c == '\r' || c == '\u00A0' || c == '│' || c == '┃';
  }
}
