package com.consullo.orchestrator.exec;

import java.util.List;

/**
 * A model name split into its base model and optional reasoning-effort suffix
 * ({@code gpt-5.3-codex-high} is {@code gpt-5.3-codex} at effort {@code high}).
 *
 * @param baseModel model without the effort suffix
 * @param effort effort level, or null when absent
 * @since 1.0
 */
public record ModelSpec(String baseModel, String effort) {

  /** Recognised effort levels. */
  public static final List<String> EFFORTS = List.of("minimal", "low", "medium", "high", "xhigh");

  public static ModelSpec parse(final String model) {
    if (model == null || model.isBlank()) {
      return new ModelSpec("", null);
    }
    final String m = model.trim();
    for (String effort : EFFORTS) {
      final String suffix = "-" + effort;
      if (m.length() > suffix.length() && m.endsWith(suffix)) {
        return new ModelSpec(m.substring(0, m.length() - suffix.length()), effort);
      }
    }
    return new ModelSpec(m, null);
  }

  public boolean hasModel() {
    return !baseModel.isEmpty();
  }
}
