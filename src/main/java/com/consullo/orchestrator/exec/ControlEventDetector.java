package com.consullo.orchestrator.exec;

import com.consullo.orchestrator.stream.Message;
import com.consullo.orchestrator.stream.ToolActivity;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects tool invocations that must hand control back to a human.
 *
 * <p>
 * Question tools stop the execution as soon as they are seen. The
 * finish-planning tool stops it once its own result is in and no plan sub-task
 * or markdown write is still running, or once the grace period has elapsed.
 * </p>
 *
 * @since 1.0
 */
public final class ControlEventDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ControlEventDetector.class);

  public static final Set<String> QUESTION_TOOLS = Set.of("askuserquestion", "ask_user_question", "request_user_input");
  public static final String FINISH_PLANNING_TOOL = "ExitPlanMode";
  public static final String SUBTASK_TOOL = "Task";
  public static final String PLAN_SUBAGENT = "plan";
  public static final Set<String> WRITE_TOOLS = Set.of("Write", "Edit", "MultiEdit");

  private final Duration planGracePeriod;

  public ControlEventDetector(final Duration planGracePeriod) {
    Validate.notNull(planGracePeriod, "planGracePeriod must not be null");
    this.planGracePeriod = planGracePeriod;
  }

  /**
   * Updates {@code state} from one message.
   *
   * @param message decoded message
   * @param state control state of the execution
   * @param now current time
   * @return signal for the executing loop
   */
  public ControlSignal inspect(final Message message, final ExecutionState state, final Instant now) {
    if (message instanceof Message.ToolCall) {
      return onToolCall(((Message.ToolCall) message).activity(), state, now);
    }
    if (message instanceof Message.ToolResult) {
      return onToolResult(((Message.ToolResult) message).activity(), state, now);
    }
    return planReadiness(state, now);
  }

  /**
   * Re-evaluates time-based conditions while the stream is quiet.
   */
  public ControlSignal onTick(final ExecutionState state, final Instant now) {
    return planReadiness(state, now);
  }

  public static boolean isQuestionTool(final String name) {
    return name != null && QUESTION_TOOLS.contains(name.toLowerCase(Locale.ROOT));
  }

  private ControlSignal onToolCall(final ToolActivity call, final ExecutionState state, final Instant now) {
    final String name = call.name();

    if (isQuestionTool(name)) {
      LOGGER.info("Question tool {} detected in execution {}", name, state.executionId());
      state.markQuestion();
      return ControlSignal.QUESTION;
    }

    if (FINISH_PLANNING_TOOL.equals(name)) {
      LOGGER.info("Finish-planning tool detected in execution {}", state.executionId());
      state.markExitPlan(call.id(), now);
      final String plan = call.inputText("plan");
      if (plan != null && !plan.isBlank()) {
        state.offerExitPlanInput(plan);
      }
      return ControlSignal.NONE;
    }

    if (SUBTASK_TOOL.equals(name)) {
      final String subagent = call.inputText("subagent_type");
      if (subagent != null && PLAN_SUBAGENT.equalsIgnoreCase(subagent)) {
        LOGGER.debug("Plan sub-task {} started", call.id());
        state.startPlanSubtask(call.id());
      }
      return ControlSignal.NONE;
    }

    if (WRITE_TOOLS.contains(name)) {
      final String path = call.inputText("file_path");
      if (path != null && path.toLowerCase(Locale.ROOT).endsWith(".md")) {
        LOGGER.debug("Markdown write {} pending for {}", call.id(), path);
        state.addPendingWrite(call.id(), path);
        final String content = call.inputText("content");
        if (content != null && !content.isBlank()) {
          state.offerWrittenPlan(content);
        }
      }
    }
    return ControlSignal.NONE;
  }

  private ControlSignal onToolResult(final ToolActivity result, final ExecutionState state, final Instant now) {
    final String id = result.id();

    if (id.equals(state.planSubtaskId())) {
      state.completePlanSubtask();
      if (!result.isError() && result.fullResultText() != null && !result.fullResultText().isBlank()) {
        state.offerSubtaskPlan(result.fullResultText());
      }
    }

    state.completePendingWrite(id);

    if (state.isExitPlanDetected() && id.equals(state.exitPlanToolId())) {
      state.markExitPlanResult(result.isError());
      if (result.isError()) {
        LOGGER.warn("Finish-planning tool failed in execution {}: {}", state.executionId(), result.resultText());
        return ControlSignal.PLAN_FAILED;
      }
    }
    return planReadiness(state, now);
  }

  private ControlSignal planReadiness(final ExecutionState state, final Instant now) {
    if (!state.isExitPlanDetected() || state.isExitPlanFailed()) {
      return ControlSignal.NONE;
    }
    if (state.isExitPlanResultSeen() && state.isPlanGateOpen()) {
      return ControlSignal.PLAN_READY;
    }
    final Instant detectedAt = state.exitPlanDetectedAt();
    if (detectedAt != null && !now.isBefore(detectedAt.plus(planGracePeriod))) {
      if (!state.isPlanGateOpen()) {
        LOGGER.warn("Plan grace period elapsed with pending work in execution {}: subtaskDone={}, writes={}",
                state.executionId(), state.isPlanSubtaskDone(), state.pendingWrites().keySet());
        state.markPlanWriteTimedOut();
      }
      return ControlSignal.PLAN_READY;
    }
    return ControlSignal.NONE;
  }
}
