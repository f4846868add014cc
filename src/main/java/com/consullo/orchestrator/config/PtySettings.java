package com.consullo.orchestrator.config;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Defaults for pooled PTY sessions.
 *
 * @param startupTimeout longest wait for the readiness marker
 * @param inactivityTimeout silence that marks a response complete
 * @param readTick granularity of output polling
 * @param callTimeout overall limit for one {@code send}
 * @param idleTimeout idle age after which the sweep stops an IDLE session
 * @param stopGrace wait after each termination step
 * @param flushWindow silence that ends the post-startup flush
 * @param columns terminal columns
 * @param rows terminal rows
 * @param sweepInterval period of the background sweep
 * @param maxSessions pool capacity
 * @param exitCommand in-band command that asks the CLI to quit
 * @since 1.0
 */
public record PtySettings(
    Duration startupTimeout,
    Duration inactivityTimeout,
    Duration readTick,
    Duration callTimeout,
    Duration idleTimeout,
    Duration stopGrace,
    Duration flushWindow,
    int columns,
    int rows,
    Duration sweepInterval,
    int maxSessions,
    String exitCommand) {

  public PtySettings {
    Validate.notNull(startupTimeout, "startupTimeout must not be null");
    Validate.notNull(inactivityTimeout, "inactivityTimeout must not be null");
    Validate.notNull(readTick, "readTick must not be null");
    Validate.notNull(callTimeout, "callTimeout must not be null");
    Validate.notNull(idleTimeout, "idleTimeout must not be null");
    Validate.notNull(stopGrace, "stopGrace must not be null");
    Validate.notNull(flushWindow, "flushWindow must not be null");
    Validate.notNull(sweepInterval, "sweepInterval must not be null");
    Validate.isTrue(columns > 0 && rows > 0, "columns/rows must be positive");
    Validate.isTrue(maxSessions > 0, "maxSessions must be positive");
    Validate.notNull(exitCommand, "exitCommand must not be null");
  }

  public static PtySettings defaults() {
    return new PtySettings(
        Duration.ofSeconds(30),
        Duration.ofSeconds(10),
        Duration.ofMillis(100),
        Duration.ofHours(1),
        Duration.ofMinutes(30),
        Duration.ofMillis(500),
        Duration.ofMillis(300),
        120,
        40,
        Duration.ofSeconds(60),
        10,
        "/exit");
  }
}
