package com.consullo.orchestrator.config;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Timeouts applied to one-shot and RPC executions.
 *
 * @param readTimeout longest tolerated silence on stdout before the process is
 * treated as hung
 * @param pollTick granularity at which cancellation and deadlines are checked
 * @param terminationGrace wait after each termination step before escalating
 * @param planGracePeriod longest wait after a finish-planning request for
 * in-flight plan work to settle
 * @param callbackTimeout longest wait for a human-mediated callback answer
 * @since 1.0
 */
public record ExecutionTimeouts(
    Duration readTimeout,
    Duration pollTick,
    Duration terminationGrace,
    Duration planGracePeriod,
    Duration callbackTimeout) {

  public ExecutionTimeouts {
    Validate.notNull(readTimeout, "readTimeout must not be null");
    Validate.notNull(pollTick, "pollTick must not be null");
    Validate.notNull(terminationGrace, "terminationGrace must not be null");
    Validate.notNull(planGracePeriod, "planGracePeriod must not be null");
    Validate.notNull(callbackTimeout, "callbackTimeout must not be null");
    Validate.isTrue(!pollTick.isNegative() && !pollTick.isZero(), "pollTick must be positive");
  }

  public static ExecutionTimeouts defaults() {
    return new ExecutionTimeouts(
        Duration.ofMinutes(30),
        Duration.ofMillis(100),
        Duration.ofSeconds(5),
        Duration.ofSeconds(15),
        Duration.ofMinutes(10));
  }
}
