package com.consullo.orchestrator.pty;

/**
 * Thrown when the pool is full and no idle session can be evicted.
 *
 * @since 1.0
 */
public class PoolExhaustedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public PoolExhaustedException(final int maxSessions) {
    super("Max sessions (" + maxSessions + ") reached and no idle sessions to evict");
  }
}
