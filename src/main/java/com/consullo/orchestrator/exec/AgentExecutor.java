package com.consullo.orchestrator.exec;

/**
 * Runs one prompt against a backend CLI and reports the outcome.
 *
 * @since 1.0
 */
public interface AgentExecutor {

  /**
   * Executes a turn, blocking the calling thread until it ends.
   *
   * @param request prompt and routing inputs
   * @param listener receives each decoded message
   * @return outcome; partial output is kept on failure and cancellation
   */
  ExecutionResult execute(ExecutionRequest request, MessageListener listener);

  /**
   * Requests cancellation of a running execution.
   *
   * @param executionId execution id
   * @return true when the id was running
   */
  boolean cancel(String executionId);

  /**
   * Requests cancellation of every running execution of an owner.
   *
   * @param ownerKey owner/conversation key
   * @return number of executions signalled
   */
  int cancelByOwner(String ownerKey);
}
