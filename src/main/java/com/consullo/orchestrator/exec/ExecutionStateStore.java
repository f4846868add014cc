package com.consullo.orchestrator.exec;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Lock-guarded map of per-execution control state.
 *
 * @since 1.0
 */
public final class ExecutionStateStore {

  private final Object lock = new Object();
  private final Map<String, ExecutionState> states = new HashMap<>();

  /**
   * Creates the state of a new execution.
   *
   * @throws IllegalStateException when the id already has live state
   */
  public ExecutionState create(final String executionId) {
    Validate.notBlank(executionId, "executionId must not be blank");
    synchronized (lock) {
      if (states.containsKey(executionId)) {
        throw new IllegalStateException("Execution state already exists for " + executionId);
      }
      final ExecutionState state = new ExecutionState(executionId);
      states.put(executionId, state);
      return state;
    }
  }

  public Optional<ExecutionState> get(final String executionId) {
    synchronized (lock) {
      return Optional.ofNullable(states.get(executionId));
    }
  }

  public void remove(final String executionId) {
    synchronized (lock) {
      states.remove(executionId);
    }
  }

  public int size() {
    synchronized (lock) {
      return states.size();
    }
  }
}
