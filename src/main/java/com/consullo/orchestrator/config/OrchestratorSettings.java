package com.consullo.orchestrator.config;

import org.apache.commons.lang3.Validate;

/**
 * Complete engine configuration.
 *
 * @param execution one-shot and RPC timeouts
 * @param claude discrete-message backend settings
 * @param codex item/event backend settings
 * @param pty pooled PTY session settings
 * @param decoderBufferChars cap on buffered JSON fragment characters
 * @since 1.0
 */
public record OrchestratorSettings(
    ExecutionTimeouts execution,
    ClaudeSettings claude,
    CodexSettings codex,
    PtySettings pty,
    int decoderBufferChars) {

  public OrchestratorSettings {
    Validate.notNull(execution, "execution must not be null");
    Validate.notNull(claude, "claude must not be null");
    Validate.notNull(codex, "codex must not be null");
    Validate.notNull(pty, "pty must not be null");
    Validate.isTrue(decoderBufferChars > 0, "decoderBufferChars must be positive");
  }

  public static OrchestratorSettings defaults() {
    return new OrchestratorSettings(
        ExecutionTimeouts.defaults(),
        ClaudeSettings.defaults(),
        CodexSettings.defaults(),
        PtySettings.defaults(),
        1024 * 1024);
  }
}
