package com.consullo.orchestrator.pty;

/**
 * Lifecycle of a pooled PTY session.
 *
 * <pre>
 * STARTING -&gt; IDLE | ERROR | STOPPING
 * IDLE -&gt; BUSY | ERROR | STOPPING
 * BUSY -&gt; IDLE | ERROR | STOPPING
 * ERROR -&gt; STOPPING
 * STOPPING -&gt; STOPPED
 * </pre>
 *
 * Any other move is rejected with {@link IllegalStateException} by the
 * session.
 *
 * @since 1.0
 */
public enum PtySessionState {
  STARTING,
  IDLE,
  BUSY,
  ERROR,
  STOPPING,
  STOPPED;

  /**
   * True for states in which the pool hands the session out again.
   */
  public boolean isReusable() {
    return this == STARTING || this == IDLE || this == BUSY;
  }

  public boolean canTransitionTo(final PtySessionState next) {
    switch (this) {
      case STARTING:
        return next == IDLE || next == ERROR || next == STOPPING;
      case IDLE:
        return next == BUSY || next == STOPPING || next == ERROR;
      case BUSY:
        return next == IDLE || next == ERROR || next == STOPPING;
      case ERROR:
        return next == STOPPING;
      case STOPPING:
        return next == STOPPED;
      default:
        return false;
    }
  }
}
