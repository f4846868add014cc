package com.consullo.orchestrator.pty;

/**
 * Thrown when a PTY session cannot be spawned or never became ready.
 *
 * @since 1.0
 */
public class SessionStartException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public SessionStartException(final String message) {
    super(message);
  }

  public SessionStartException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
