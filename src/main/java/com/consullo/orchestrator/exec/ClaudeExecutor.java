package com.consullo.orchestrator.exec;

import com.consullo.orchestrator.config.ClaudeSettings;
import com.consullo.orchestrator.config.ExecutionTimeouts;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.commons.lang3.Validate;

/**
 * One-shot executor for the discrete-message backend
 * ({@code claude -p --output-format stream-json}).
 *
 * @since 1.0
 */
public final class ClaudeExecutor extends OneShotExecutor {

  static final List<String> SESSION_NOT_FOUND_MARKERS = List.of("no conversation found", "session not found");

  private final ClaudeSettings settings;

  public ClaudeExecutor(
          final ClaudeSettings settings,
          final ProcessLauncher launcher,
          final ProcessRegistry registry,
          final ExecutionStateStore states,
          final ExecutionTimeouts timeouts,
          final int decoderBufferChars,
          final Predicate<String> planTextClassifier,
          final Clock clock) {
    super("claude", launcher, registry, states, timeouts, decoderBufferChars, planTextClassifier, clock);
    Validate.notNull(settings, "settings must not be null");
    this.settings = settings;
  }

  @Override
  protected List<String> buildCommand(final ExecutionRequest request, final boolean forceAutoApprove) {
    final List<String> cmd = new ArrayList<>(12);
    cmd.add(settings.executable());
    cmd.add("-p");
    cmd.add("--verbose");
    cmd.add("--output-format");
    cmd.add("stream-json");

    if (request.resumeSessionId() != null) {
      cmd.add("--resume");
      cmd.add(request.resumeSessionId());
    }

    final String mode = forceAutoApprove
            ? settings.autoApproveMode()
            : CliArguments.allowedOrDefault("permission mode", request.mode(), settings.allowedModes(), settings.defaultMode());
    cmd.add("--permission-mode");
    cmd.add(mode);

    final String model = CliArguments.allowedOrDefault(
            "model", request.model(), settings.allowedModels(), settings.defaultModel());
    if (!model.isBlank()) {
      cmd.add("--model");
      cmd.add(model);
    }

    cmd.add(request.prompt());
    return cmd;
  }

  @Override
  protected boolean isValidResumeId(final String id) {
    return CliArguments.isUuid(id);
  }

  @Override
  protected boolean isSessionNotFound(final String errorText) {
    return CliArguments.containsAnyIgnoreCase(errorText, SESSION_NOT_FOUND_MARKERS);
  }
}
