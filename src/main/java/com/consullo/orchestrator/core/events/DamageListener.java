package com.consullo.orchestrator.core.events;

import com.consullo.orchestrator.core.TerminalSnapshot;

/**
 * Listener for terminal damage events.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface DamageListener {

  /**
   * Called on the feeding thread after the terminal state changed.
   *
   * @param snapshot current terminal snapshot
   * @param damageEvent damage event describing the changed region
   * @throws Exception if the listener fails; the core logs it and continues
   */
  void onDamage(TerminalSnapshot snapshot, DamageEvent damageEvent) throws Exception;
}
