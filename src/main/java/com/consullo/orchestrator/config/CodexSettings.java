package com.consullo.orchestrator.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.Validate;

/**
 * Settings for the item/event backend CLI and its app-server variant.
 *
 * @param executable CLI executable name or path
 * @param defaultSandbox sandbox mode used when none (or an invalid one) is
 * requested
 * @param allowedSandboxes accepted sandbox modes
 * @param approvalMode approval policy; {@code never} means unattended operation
 * @param defaultModel model used when an invalid one is requested; blank omits
 * the flag
 * @param allowedModels accepted base models (effort suffix removed)
 * @param defaultInstructionsFile optional file whose text prefixes every RPC
 * turn (may be null)
 * @since 1.0
 */
public record CodexSettings(
    String executable,
    String defaultSandbox,
    List<String> allowedSandboxes,
    String approvalMode,
    String defaultModel,
    List<String> allowedModels,
    Path defaultInstructionsFile) {

  /** Approval policies understood by the backend. */
  public static final List<String> APPROVAL_MODES = List.of("untrusted", "on-request", "never");

  public static final String UNATTENDED_APPROVAL = "never";

  public CodexSettings {
    Validate.notBlank(executable, "executable must not be blank");
    Validate.notNull(allowedSandboxes, "allowedSandboxes must not be null");
    Validate.notNull(allowedModels, "allowedModels must not be null");
    Validate.isTrue(allowedSandboxes.contains(defaultSandbox),
        "defaultSandbox %s is not an allowed sandbox", defaultSandbox);
    approvalMode = normalizeApprovalMode(approvalMode);
    allowedSandboxes = List.copyOf(allowedSandboxes);
    allowedModels = List.copyOf(allowedModels);
    defaultModel = defaultModel != null ? defaultModel : "";
  }

  public static CodexSettings defaults() {
    return new CodexSettings(
        "codex",
        "workspace-write",
        List.of("read-only", "workspace-write", "danger-full-access"),
        "on-request",
        "",
        List.of("gpt-5.3-codex", "gpt-5.2-codex", "gpt-5.2", "gpt-5.1-codex-max", "gpt-5.1-codex-mini"),
        null);
  }

  public boolean isUnattended() {
    return UNATTENDED_APPROVAL.equals(approvalMode);
  }

  /**
   * Maps the deprecated {@code on-failure} policy to {@code on-request}; any
   * unknown value falls back to {@code on-request}.
   */
  public static String normalizeApprovalMode(final String mode) {
    if (mode == null) {
      return "on-request";
    }
    final String m = mode.trim().toLowerCase(Locale.ROOT);
    if (APPROVAL_MODES.contains(m)) {
      return m;
    }
    return "on-request";
  }
}
