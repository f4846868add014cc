package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.config.ClaudeSettings;
import com.consullo.orchestrator.config.CodexSettings;
import com.consullo.orchestrator.exec.CliArguments;
import com.consullo.orchestrator.exec.CodexExecutor;
import com.consullo.orchestrator.exec.ExecutionRequest;
import com.consullo.orchestrator.exec.ModelSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Session configurations for the interactive variants of the backend CLIs.
 *
 * @since 1.0
 */
public final class PtyCommands {

  private PtyCommands() {
  }

  /**
   * Interactive item/event CLI printing JSON events
   * ({@code codex --json ... --cd DIR}).
   */
  public static Function<ExecutionRequest, PtySessionConfig> codex(final CodexSettings settings) {
    return request -> {
      final List<String> cmd = new ArrayList<>(12);
      cmd.add(settings.executable());
      cmd.add("--json");
      cmd.add("--sandbox");
      cmd.add(CliArguments.allowedOrDefault(
              "sandbox mode", request.mode(), settings.allowedSandboxes(), settings.defaultSandbox()));
      cmd.add("--ask-for-approval");
      cmd.add(settings.approvalMode());
      final ModelSpec model = CodexExecutor.resolveModel(settings, request.model());
      if (model.hasModel()) {
        cmd.add("--model");
        cmd.add(model.baseModel());
      }
      if (model.effort() != null) {
        cmd.add("-c");
        cmd.add("model_reasoning_effort=\"" + model.effort() + "\"");
      }
      cmd.add("--cd");
      cmd.add(request.workingDirectory().toString());
      return new PtySessionConfig(request.ownerKey(), cmd, request.workingDirectory(), Map.of(), OutputMode.JSON_EVENTS);
    };
  }

  /**
   * Full-screen discrete-message CLI, captured as a terminal transcript.
   */
  public static Function<ExecutionRequest, PtySessionConfig> claude(final ClaudeSettings settings) {
    return request -> {
      final List<String> cmd = new ArrayList<>(8);
      cmd.add(settings.executable());
      cmd.add("--permission-mode");
      cmd.add(CliArguments.allowedOrDefault(
              "permission mode", request.mode(), settings.allowedModes(), settings.defaultMode()));
      final String model = CliArguments.allowedOrDefault(
              "model", request.model(), settings.allowedModels(), settings.defaultModel());
      if (!model.isBlank()) {
        cmd.add("--model");
        cmd.add(model);
      }
      if (CliArguments.isUuid(request.resumeSessionId())) {
        cmd.add("--resume");
        cmd.add(request.resumeSessionId());
      }
      return new PtySessionConfig(
              request.ownerKey(), cmd, request.workingDirectory(), Map.of(), OutputMode.TERMINAL_TRANSCRIPT);
    };
  }
}
