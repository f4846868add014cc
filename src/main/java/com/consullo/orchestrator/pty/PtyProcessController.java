package com.consullo.orchestrator.pty;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal controller for a PTY-attached subprocess.
 *
 * <p>Implementations must provide:
 * - access to PTY input/output streams
 * - resize support
 * - exit monitoring and forced termination
 *
 * @since 1.0
 */
public interface PtyProcessController extends AutoCloseable {

  InputStream getPtyOutput() throws Exception;

  OutputStream getPtyInput() throws Exception;

  void resize(final int columns, final int rows) throws Exception;

  /**
   * Completes with the exit code once the process has terminated.
   */
  CompletableFuture<Integer> onExit() throws Exception;

  int pid() throws Exception;

  boolean isAlive() throws Exception;

  /**
   * Kills the process without giving it a chance to clean up.
   */
  void destroyForcibly() throws Exception;

  /**
   * Requests termination and releases the PTY.
   */
  @Override
  void close() throws Exception;
}
