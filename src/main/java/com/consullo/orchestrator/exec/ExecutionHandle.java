package com.consullo.orchestrator.exec;

/**
 * Cancellation hook for one running execution.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ExecutionHandle {

  /**
   * Requests that the execution stop. Must be safe to call more than once and
   * from any thread.
   */
  void cancel();
}
