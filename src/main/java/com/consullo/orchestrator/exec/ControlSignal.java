package com.consullo.orchestrator.exec;

/**
 * Outcome of inspecting one message for control events.
 *
 * @since 1.0
 */
public enum ControlSignal {
  /** Keep streaming. */
  NONE,
  /** The agent asked the human a question; stop the process now. */
  QUESTION,
  /** The plan is ready for approval; stop the process now. */
  PLAN_READY,
  /** The finish-planning tool was rejected; stop and retry with auto-approve. */
  PLAN_FAILED
}
