package com.consullo.orchestrator.exec;

/**
 * Registry handle that spans a whole execution, across spawns and retries.
 *
 * <p>
 * A cancellation is remembered even while no attempt is attached; the next
 * {@link #attach} runs its hook at once and {@link #isRequested()} lets the
 * retry loop stop before spawning again.
 * </p>
 *
 * @since 1.0
 */
public final class CancellationScope implements ExecutionHandle {

  private final Object lock = new Object();
  private boolean requested;
  private ExecutionHandle current;

  @Override
  public void cancel() {
    final ExecutionHandle hook;
    synchronized (lock) {
      requested = true;
      hook = current;
    }
    if (hook != null) {
      hook.cancel();
    }
  }

  public boolean isRequested() {
    synchronized (lock) {
      return requested;
    }
  }

  /**
   * Installs the hook of the running attempt, replacing the previous one.
   */
  public void attach(final ExecutionHandle hook) {
    final boolean runNow;
    synchronized (lock) {
      current = hook;
      runNow = requested;
    }
    if (runNow) {
      hook.cancel();
    }
  }

  public void detach() {
    synchronized (lock) {
      current = null;
    }
  }
}
