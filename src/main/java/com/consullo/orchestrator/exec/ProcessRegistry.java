package com.consullo.orchestrator.exec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared table of running executions, keyed by execution id and by owner.
 *
 * <p>
 * One instance is created by the caller and handed to every executor that
 * should be cancellable through it. All access is serialized on a single lock;
 * cancellation hooks run outside the lock.
 * </p>
 *
 * @since 1.0
 */
public final class ProcessRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRegistry.class);

  private final Object lock = new Object();
  private final Map<String, ExecutionHandle> handlesById = new HashMap<>();
  private final Map<String, String> ownersById = new HashMap<>();

  /**
   * Registers a running execution.
   *
   * @throws IllegalStateException when the id is already registered
   */
  public void register(final String executionId, final String ownerKey, final ExecutionHandle handle) {
    Validate.notBlank(executionId, "executionId must not be blank");
    Validate.notBlank(ownerKey, "ownerKey must not be blank");
    Validate.notNull(handle, "handle must not be null");
    synchronized (lock) {
      if (handlesById.containsKey(executionId)) {
        throw new IllegalStateException("Execution " + executionId + " is already running");
      }
      handlesById.put(executionId, handle);
      ownersById.put(executionId, ownerKey);
    }
    LOGGER.debug("Registered execution {} for owner {}", executionId, ownerKey);
  }

  /**
   * Removes an execution. Safe to call for ids that are not registered.
   *
   * @return true when the id was registered
   */
  public boolean deregister(final String executionId) {
    final boolean removed;
    synchronized (lock) {
      removed = handlesById.remove(executionId) != null;
      ownersById.remove(executionId);
    }
    if (removed) {
      LOGGER.debug("Deregistered execution {}", executionId);
    }
    return removed;
  }

  public boolean contains(final String executionId) {
    synchronized (lock) {
      return handlesById.containsKey(executionId);
    }
  }

  public String ownerOf(final String executionId) {
    synchronized (lock) {
      return ownersById.get(executionId);
    }
  }

  public List<String> executionIdsForOwner(final String ownerKey) {
    final List<String> ids = new ArrayList<>();
    synchronized (lock) {
      for (Map.Entry<String, String> e : ownersById.entrySet()) {
        if (e.getValue().equals(ownerKey)) {
          ids.add(e.getKey());
        }
      }
    }
    return ids;
  }

  public int size() {
    synchronized (lock) {
      return handlesById.size();
    }
  }

  /**
   * Invokes the cancellation hook of one execution.
   *
   * @return true when the id was registered
   */
  public boolean cancel(final String executionId) {
    final ExecutionHandle handle;
    synchronized (lock) {
      handle = handlesById.get(executionId);
    }
    if (handle == null) {
      LOGGER.debug("Cancel requested for unknown execution {}", executionId);
      return false;
    }
    LOGGER.info("Cancelling execution {}", executionId);
    handle.cancel();
    return true;
  }

  /**
   * Invokes the cancellation hook of every execution of an owner.
   *
   * @return number of executions signalled
   */
  public int cancelByOwner(final String ownerKey) {
    int count = 0;
    for (String id : executionIdsForOwner(ownerKey)) {
      if (cancel(id)) {
        count++;
      }
    }
    return count;
  }
}
