package com.consullo.orchestrator.exec;

import com.consullo.orchestrator.config.CodexSettings;
import com.consullo.orchestrator.config.ExecutionTimeouts;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.commons.lang3.Validate;

/**
 * One-shot executor for the item/event backend ({@code codex exec --json}).
 *
 * @since 1.0
 */
public final class CodexExecutor extends OneShotExecutor {

  /** Error text that means a resumed thread or session is gone. */
  public static final List<String> SESSION_NOT_FOUND_MARKERS = List.of(
          "no conversation found", "session not found", "thread not found", "no rollout found");

  private final CodexSettings settings;

  public CodexExecutor(
          final CodexSettings settings,
          final ProcessLauncher launcher,
          final ProcessRegistry registry,
          final ExecutionStateStore states,
          final ExecutionTimeouts timeouts,
          final int decoderBufferChars,
          final Predicate<String> planTextClassifier,
          final Clock clock) {
    super("codex", launcher, registry, states, timeouts, decoderBufferChars, planTextClassifier, clock);
    Validate.notNull(settings, "settings must not be null");
    this.settings = settings;
  }

  @Override
  protected List<String> buildCommand(final ExecutionRequest request, final boolean forceAutoApprove) {
    final List<String> cmd = new ArrayList<>(16);
    cmd.add(settings.executable());
    cmd.add("exec");
    if (request.resumeSessionId() != null) {
      cmd.add("resume");
      cmd.add(request.resumeSessionId());
    }
    cmd.add("--json");

    final ModelSpec model = resolveModel(settings, request.model());
    if (model.hasModel()) {
      cmd.add("--model");
      cmd.add(model.baseModel());
    }
    if (model.effort() != null) {
      cmd.add("-c");
      cmd.add("model_reasoning_effort=\"" + model.effort() + "\"");
    }

    cmd.add("--sandbox");
    cmd.add(CliArguments.allowedOrDefault(
            "sandbox mode", request.mode(), settings.allowedSandboxes(), settings.defaultSandbox()));

    if (forceAutoApprove || settings.isUnattended()) {
      cmd.add("--full-auto");
    }

    cmd.add("--cd");
    cmd.add(request.workingDirectory().toString());
    cmd.add(request.prompt());
    return cmd;
  }

  /**
   * Splits the effort suffix off {@code requested} and checks the base model
   * against the allow-list; an invalid model yields the configured default.
   */
  public static ModelSpec resolveModel(final CodexSettings settings, final String requested) {
    final ModelSpec spec = ModelSpec.parse(requested);
    if (!spec.hasModel()) {
      return ModelSpec.parse(settings.defaultModel());
    }
    final String base = CliArguments.allowedOrDefault("model", spec.baseModel(), settings.allowedModels(), null);
    if (base == null) {
      return ModelSpec.parse(settings.defaultModel());
    }
    return spec;
  }

  @Override
  protected boolean isValidResumeId(final String id) {
    return CliArguments.isOpaqueId(id);
  }

  @Override
  protected boolean isSessionNotFound(final String errorText) {
    return CliArguments.containsAnyIgnoreCase(errorText, SESSION_NOT_FOUND_MARKERS);
  }
}
