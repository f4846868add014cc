package com.consullo.orchestrator.exec;

import com.consullo.orchestrator.stream.Message;
import com.consullo.orchestrator.stream.ToolActivity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ControlEventDetector}.
 *
 * @since 1.0
 */
public class ControlEventDetectorTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final ControlEventDetector detector = new ControlEventDetector(Duration.ofSeconds(15));
  private final ExecutionState state = new ExecutionState("e1");

  @Test
  @DisplayName("Should signal a question for any question tool name regardless of case")
  void inspect_QuestionTool_SignalsQuestion() {
    assertThat(detector.inspect(call("c1", "ask_user_question", MAPPER.createObjectNode()), state, T0))
            .isEqualTo(ControlSignal.QUESTION);
    assertThat(state.isAskQuestionDetected()).isTrue();
    assertThat(ControlEventDetector.isQuestionTool("AskUserQuestion")).isTrue();
    assertThat(ControlEventDetector.isQuestionTool("Bash")).isFalse();
  }

  @Test
  @DisplayName("Should hold the plan until the plan sub-task finishes")
  void inspect_PlanSubtaskInFlight_WaitsForSubtask() {
    detector.inspect(call("s1", "Task", MAPPER.createObjectNode().put("subagent_type", "Plan")), state, T0);
    detector.inspect(call("p1", "ExitPlanMode", MAPPER.createObjectNode()), state, T0);

    assertThat(detector.inspect(result("p1", "ok", false), state, T0)).isEqualTo(ControlSignal.NONE);
    assertThat(detector.inspect(result("s1", "## The plan", false), state, T0.plusSeconds(1)))
            .isEqualTo(ControlSignal.PLAN_READY);
    assertThat(state.planContentCandidate()).isEqualTo("## The plan");
    assertThat(state.isPlanWriteTimedOut()).isFalse();
  }

  @Test
  @DisplayName("Should prefer the sub-task plan over a markdown write and the tool input")
  void planContentCandidate_AllSources_PrefersSubtask() {
    detector.inspect(call("w1", "Write", MAPPER.createObjectNode()
            .put("file_path", "docs/plan.MD").put("content", "written")), state, T0);
    detector.inspect(call("p1", "ExitPlanMode", MAPPER.createObjectNode().put("plan", "inline")), state, T0);
    assertThat(state.planContentCandidate()).isEqualTo("written");

    detector.inspect(call("s1", "Task", MAPPER.createObjectNode().put("subagent_type", "plan")), state, T0);
    detector.inspect(result("s1", "subtask", false), state, T0);

    assertThat(state.planContentCandidate()).isEqualTo("subtask");
  }

  @Test
  @DisplayName("Should release the plan after the grace period and record the timeout")
  void onTick_GraceElapsedWithPendingWrite_SignalsPlanReady() {
    detector.inspect(call("w1", "Edit", MAPPER.createObjectNode().put("file_path", "PLAN.md")), state, T0);
    detector.inspect(call("p1", "ExitPlanMode", MAPPER.createObjectNode()), state, T0);

    assertThat(detector.onTick(state, T0.plusSeconds(14))).isEqualTo(ControlSignal.NONE);
    assertThat(detector.onTick(state, T0.plusSeconds(15))).isEqualTo(ControlSignal.PLAN_READY);
    assertThat(state.isPlanWriteTimedOut()).isTrue();
  }

  @Test
  @DisplayName("Should signal a failed plan finish when its result is an error")
  void inspect_ExitPlanError_SignalsPlanFailed() {
    detector.inspect(call("p1", "ExitPlanMode", MAPPER.createObjectNode()), state, T0);

    assertThat(detector.inspect(result("p1", "User rejected", true), state, T0)).isEqualTo(ControlSignal.PLAN_FAILED);
    assertThat(state.isExitPlanFailed()).isTrue();
    assertThat(detector.onTick(state, T0.plusSeconds(60))).isEqualTo(ControlSignal.NONE);
  }

  @Test
  @DisplayName("Should ignore writes of non-markdown files")
  void inspect_NonMarkdownWrite_DoesNotGatePlan() {
    detector.inspect(call("w1", "Write", MAPPER.createObjectNode().put("file_path", "Main.java")), state, T0);

    assertThat(state.pendingWrites()).isEmpty();
  }

  private static Message call(final String id, final String name, final ObjectNode input) {
    return new Message.ToolCall(new ToolActivity(id, name, input, T0));
  }

  private static Message result(final String id, final String text, final boolean error) {
    return new Message.ToolResult(ToolActivity.resultOnly(id, MAPPER.createObjectNode(), text, error, T0));
  }
}
