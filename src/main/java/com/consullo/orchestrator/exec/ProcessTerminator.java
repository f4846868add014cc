package com.consullo.orchestrator.exec;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops a process with escalation: graceful signal, bounded wait, forced kill,
 * bounded wait.
 *
 * @since 1.0
 */
public final class ProcessTerminator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessTerminator.class);

  private final Duration grace;

  public ProcessTerminator(final Duration grace) {
    Validate.notNull(grace, "grace must not be null");
    this.grace = grace;
  }

  /**
   * Terminates {@code process}.
   *
   * @return true when the process is no longer alive
   */
  public boolean terminate(final Process process) {
    if (process == null || !process.isAlive()) {
      return true;
    }
    try {
      process.destroy();
      if (process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      LOGGER.warn("Process did not exit within {} ms of SIGTERM; killing", grace.toMillis());
      process.destroyForcibly();
      if (process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
    if (process.isAlive()) {
      LOGGER.error("Process is still alive after forced kill");
      return false;
    }
    return true;
  }
}
