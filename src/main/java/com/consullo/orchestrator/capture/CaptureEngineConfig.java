package com.consullo.orchestrator.capture;

import org.apache.commons.lang3.Validate;

/**
 * Capture engine configuration values.
 *
 * @param volatileRowCount bottom rows never captured from the screen (input
 * box, spinner and status bar of agent TUIs)
 * @param stabilityWindowMillis milliseconds a row must remain unchanged before
 * emission
 * @param suppressAlternateScreen if true, suppress screen-stability emissions
 * while in alternate screen
 * @param dedupeCapacity number of recently emitted lines remembered for
 * duplicate suppression
 * @since 1.0
 */
public record CaptureEngineConfig(
    int volatileRowCount,
    long stabilityWindowMillis,
    boolean suppressAlternateScreen,
    int dedupeCapacity) {

  public CaptureEngineConfig {
    Validate.isTrue(volatileRowCount >= 0, "volatileRowCount must not be negative");
    Validate.isTrue(stabilityWindowMillis >= 0, "stabilityWindowMillis must not be negative");
    Validate.isTrue(dedupeCapacity > 0, "dedupeCapacity must be positive");
  }

  /**
   * Settings tuned for full-screen agent CLIs: the bottom four rows hold the
   * prompt box and status line.
   */
  public static CaptureEngineConfig agentDefaults() {
    return new CaptureEngineConfig(4, 500L, false, 2_000);
  }
}
