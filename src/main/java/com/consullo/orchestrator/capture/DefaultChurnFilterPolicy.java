package com.consullo.orchestrator.capture;

/**
 * Default churn suppression heuristics for agent CLI terminals.
 *
 * <p>
 * Suppresses spinner and progress rows, box-drawing borders, and the status
 * hints full-screen agent CLIs keep redrawing ("esc to interrupt", "? for
 * shortcuts", animated "Thinking…" rows). No regex is used.
 * </p>
 */
public final class DefaultChurnFilterPolicy implements ChurnFilterPolicy {

  private static final String[] STATUS_HINTS = {
    "esc to interrupt",
    "? for shortcuts",
    "ctrl+c to exit",
    "ctrl-c again to exit",
    "shift+tab to cycle",
  };

  @Override
  public boolean shouldSuppressRow(String rowText) {
    if (rowText == null) {
      return true;
    }
    final String s = rowText.strip();
    if (s.isEmpty()) {
      return false;
    }
    return isLikelySpinnerLine(s)
            || isLikelyProgressLine(s)
            || isBorderLine(s)
            || isStatusHint(s)
            || isAnimatedStatus(s);
  }

  private static boolean isLikelySpinnerLine(String s) {
    final int n = s.length();
    if (n == 1) {
      return isSpinnerGlyph(s.charAt(0));
    }
    if (n <= 3 && allDots(s)) {
      return true;
    }
    if (n >= 3 && isSpinnerGlyph(s.charAt(n - 1)) && s.charAt(n - 2) == ' ') {
      // "Working |": a word followed by a rotating glyph
      int letters = 0;
      for (int i = 0; i < n - 2; i++) {
        final char c = s.charAt(i);
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
          letters++;
        }
      }
      return letters > 0;
    }
    return false;
  }

  private static boolean isSpinnerGlyph(char c) {
    if (c == '|' || c == '/' || c == '\\' || c == '-') {
      return true;
    }
    // Braille patterns U+2800..U+28FF
    return c >= 0x2800 && c <= 0x28FF;
  }

  private static boolean isLikelyProgressLine(String s) {
    if (endsWithPercent(s)) {
      return true;
    }
    if (s.indexOf('[') >= 0 && s.indexOf(']') >= 0 && countChar(s, '=') + countChar(s, '#') >= 3) {
      return true;
    }
    return (startsWithIgnoreCase(s, "loading") || startsWithIgnoreCase(s, "thinking")
            || startsWithIgnoreCase(s, "working"))
            && (endsWithDots(s) || s.charAt(s.length() - 1) == '…');
  }

  /**
   * Rows made only of box-drawing characters and blanks (prompt box edges,
   * separators).
   */
  private static boolean isBorderLine(String s) {
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c != ' ' && !(c >= 0x2500 && c <= 0x257F)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isStatusHint(String s) {
    for (String hint : STATUS_HINTS) {
      if (containsIgnoreCase(s, hint)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Decorative glyph, a verb and an ellipsis: "✻ Pondering… (3s)".
   */
  private static boolean isAnimatedStatus(String s) {
    return isDecorativeGlyph(s.charAt(0)) && s.indexOf('…') > 0;
  }

  private static boolean isDecorativeGlyph(char c) {
    return c == '*' || c == '·' || c == '✢' || c == '✳' || c == '✶'
            || c == '✻' || c == '✽';
  }

  private static boolean endsWithPercent(String s) {
    final int n = s.length();
    if (n < 2 || s.charAt(n - 1) != '%') {
      return false;
    }
    final char prev = s.charAt(n - 2);
    return prev >= '0' && prev <= '9';
  }

  private static boolean endsWithDots(String s) {
    final int n = s.length();
    return n >= 3 && s.charAt(n - 1) == '.' && s.charAt(n - 2) == '.' && s.charAt(n - 3) == '.';
  }

  private static boolean startsWithIgnoreCase(String s, String prefix) {
    return s.regionMatches(true, 0, prefix, 0, prefix.length());
  }

  private static boolean containsIgnoreCase(String s, String part) {
    final int max = s.length() - part.length();
    for (int i = 0; i <= max; i++) {
      if (s.regionMatches(true, i, part, 0, part.length())) {
        return true;
      }
    }
    return false;
  }

  private static int countChar(String s, char c) {
    int x = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == c) {
        x++;
      }
    }
    return x;
  }

  private static boolean allDots(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) != '.') {
        return false;
      }
    }
    return !s.isEmpty();
  }
}
