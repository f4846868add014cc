package com.consullo.orchestrator.config;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Settings for the discrete-message backend CLI.
 *
 * @param executable CLI executable name or path
 * @param defaultMode permission mode used when none (or an invalid one) is
 * requested
 * @param allowedModes accepted permission modes
 * @param autoApproveMode permission mode forced when a rejected plan finish is
 * retried
 * @param defaultModel model used when an invalid one is requested; blank omits
 * the flag
 * @param allowedModels accepted model aliases
 * @since 1.0
 */
public record ClaudeSettings(
    String executable,
    String defaultMode,
    List<String> allowedModes,
    String autoApproveMode,
    String defaultModel,
    List<String> allowedModels) {

  public ClaudeSettings {
    Validate.notBlank(executable, "executable must not be blank");
    Validate.notNull(allowedModes, "allowedModes must not be null");
    Validate.notNull(allowedModels, "allowedModels must not be null");
    Validate.isTrue(allowedModes.contains(defaultMode), "defaultMode %s is not an allowed mode", defaultMode);
    Validate.isTrue(allowedModes.contains(autoApproveMode), "autoApproveMode %s is not an allowed mode", autoApproveMode);
    allowedModes = List.copyOf(allowedModes);
    allowedModels = List.copyOf(allowedModels);
    defaultModel = defaultModel != null ? defaultModel : "";
  }

  public static ClaudeSettings defaults() {
    return new ClaudeSettings(
        "claude",
        "bypassPermissions",
        List.of("acceptEdits", "bypassPermissions", "default", "delegate", "dontAsk", "plan"),
        "bypassPermissions",
        "",
        List.of("opus", "sonnet", "haiku"));
  }
}
