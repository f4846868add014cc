package com.consullo.orchestrator.core;

import java.util.List;

/**
 * Read-only view over terminal history and screen content.
 *
 * <p>History lines have scrolled off the screen and no longer change. Screen
 * lines are the current display and may still be redrawn.
 *
 * @since 1.0
 */
public interface ScrollbackView {

  /**
   * Returns the number of history lines (scrolled off screen).
   *
   * @return history line count
   */
  int historyLineCount();

  /**
   * Returns the number of visible screen rows.
   *
   * @return screen row count
   */
  int screenRowCount();

  /**
   * Returns history lines for [startInclusive, endExclusive). Index 0 is the
   * oldest retained history line.
   *
   * @param startInclusive start line index inclusive
   * @param endExclusive end line index exclusive
   * @return plain-text lines, right-trimmed
   */
  List<String> readHistoryLines(int startInclusive, int endExclusive);

  /**
   * Returns screen lines for [startInclusive, endExclusive). Index 0 is the
   * top screen row.
   *
   * @param startInclusive start row index inclusive
   * @param endExclusive end row index exclusive
   * @return plain-text lines, right-trimmed
   */
  List<String> readScreenLines(int startInclusive, int endExclusive);
}
