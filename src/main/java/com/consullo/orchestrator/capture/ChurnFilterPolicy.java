package com.consullo.orchestrator.capture;

/**
 * Decides which terminal rows are redraw churn (spinners, progress bars,
 * status hints) rather than transcript content.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ChurnFilterPolicy {

  /**
   * Returns true if the row should not enter the transcript.
   *
   * @param rowText row text, trimmed
   * @return true if suppressed
   * @throws Exception if evaluation fails
   */
  boolean shouldSuppressRow(final String rowText) throws Exception;
}
