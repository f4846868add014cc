package com.consullo.orchestrator.exec;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Control flags of one in-flight execution.
 *
 * <p>
 * Written by the executing thread and read by cancelling threads, so every
 * accessor is synchronized on the instance. Instances are never shared between
 * executions.
 * </p>
 *
 * @since 1.0
 */
public final class ExecutionState {

  private final String executionId;

  private boolean cancelled;
  private boolean askQuestionDetected;

  private boolean exitPlanDetected;
  private String exitPlanToolId;
  private Instant exitPlanDetectedAt;
  private boolean exitPlanResultSeen;
  private boolean exitPlanFailed;

  private final Map<String, String> pendingWrites = new LinkedHashMap<>();
  private String planSubtaskId;
  private boolean planSubtaskDone;
  private String subtaskPlan;
  private String writtenPlan;
  private String exitPlanInput;
  private boolean planWriteTimedOut;

  ExecutionState(final String executionId) {
    this.executionId = executionId;
  }

  public String executionId() {
    return executionId;
  }

  public synchronized void markCancelled() {
    cancelled = true;
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  synchronized void markQuestion() {
    askQuestionDetected = true;
  }

  public synchronized boolean isAskQuestionDetected() {
    return askQuestionDetected;
  }

  synchronized void markExitPlan(final String toolId, final Instant at) {
    exitPlanDetected = true;
    exitPlanToolId = toolId;
    exitPlanDetectedAt = at;
    exitPlanResultSeen = false;
  }

  public synchronized boolean isExitPlanDetected() {
    return exitPlanDetected;
  }

  synchronized String exitPlanToolId() {
    return exitPlanToolId;
  }

  synchronized Instant exitPlanDetectedAt() {
    return exitPlanDetectedAt;
  }

  synchronized void markExitPlanResult(final boolean failed) {
    exitPlanResultSeen = true;
    if (failed) {
      exitPlanFailed = true;
    }
  }

  synchronized boolean isExitPlanResultSeen() {
    return exitPlanResultSeen;
  }

  public synchronized boolean isExitPlanFailed() {
    return exitPlanFailed;
  }

  synchronized void addPendingWrite(final String toolId, final String path) {
    pendingWrites.put(toolId, path);
  }

  synchronized boolean completePendingWrite(final String toolId) {
    return pendingWrites.remove(toolId) != null;
  }

  public synchronized Map<String, String> pendingWrites() {
    return Map.copyOf(pendingWrites);
  }

  synchronized void startPlanSubtask(final String toolId) {
    planSubtaskId = toolId;
    planSubtaskDone = false;
  }

  synchronized String planSubtaskId() {
    return planSubtaskId;
  }

  synchronized void completePlanSubtask() {
    planSubtaskDone = true;
  }

  public synchronized boolean isPlanSubtaskDone() {
    return planSubtaskDone;
  }

  synchronized void offerSubtaskPlan(final String text) {
    subtaskPlan = text;
  }

  synchronized void offerWrittenPlan(final String text) {
    writtenPlan = text;
  }

  synchronized void offerExitPlanInput(final String text) {
    exitPlanInput = text;
  }

  /**
   * Best plan text seen so far: a plan sub-task result, else the last markdown
   * write, else the finish-planning request's own plan field.
   */
  public synchronized String planContentCandidate() {
    if (subtaskPlan != null) {
      return subtaskPlan;
    }
    if (writtenPlan != null) {
      return writtenPlan;
    }
    return exitPlanInput;
  }

  synchronized void markPlanWriteTimedOut() {
    planWriteTimedOut = true;
  }

  public synchronized boolean isPlanWriteTimedOut() {
    return planWriteTimedOut;
  }

  /**
   * True when no plan sub-task is in flight and no markdown write is pending.
   */
  synchronized boolean isPlanGateOpen() {
    return (planSubtaskId == null || planSubtaskDone) && pendingWrites.isEmpty();
  }
}
