package com.consullo.orchestrator.pty;

/**
 * Creates unstarted sessions for the pool.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PtySessionFactory {

  PtySession create(PtySessionConfig config);
}
