package com.consullo.orchestrator.pty;

/**
 * Spawns PTY-attached processes.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PtyProcessFactory {

  /** Factory backed by pty4j. */
  PtyProcessFactory PTY4J = PtyProcessControllerPty4j::new;

  PtyProcessController spawn(PtyProcessConfig config) throws Exception;
}
