package com.consullo.orchestrator.core.events;

import java.time.Instant;

/**
 * Terminal-state change that should trigger a transcript capture pass.
 *
 * <p>Damage is tracked per changed row range. Idle ticks use
 * {@link #idle(Instant)} so rows that stopped changing can become stable.
 *
 * @param timestampUtc event timestamp in UTC
 * @param changedRowStart first changed row (inclusive)
 * @param changedRowEnd last changed row (exclusive)
 * @param fullRedraw true when the whole screen may have changed
 * @since 1.0
 */
public record DamageEvent(
    Instant timestampUtc,
    int changedRowStart,
    int changedRowEnd,
    boolean fullRedraw) {

  /**
   * Creates a full-redraw damage event.
   *
   * @param at event time
   * @return full redraw event
   */
  public static DamageEvent fullRedraw(final Instant at) {
    return new DamageEvent(at, 0, Integer.MAX_VALUE, true);
  }

  /**
   * Creates an event that reports no change, used to re-evaluate row
   * stability while output is quiet.
   *
   * @param at event time
   * @return empty damage event
   */
  public static DamageEvent idle(final Instant at) {
    return new DamageEvent(at, 0, 0, false);
  }

  public boolean isEmpty() {
    return !fullRedraw && changedRowEnd <= changedRowStart;
  }
}
