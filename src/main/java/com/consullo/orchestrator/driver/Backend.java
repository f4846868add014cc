package com.consullo.orchestrator.driver;

import java.util.Locale;

/**
 * Backend variants an {@link ExecutorFactory} can build.
 *
 * @since 1.0
 */
public enum Backend {
  /** {@code claude -p} per turn. */
  CLAUDE,
  /** {@code codex exec --json} per turn. */
  CODEX,
  /** {@code codex app-server} over JSON-RPC, one process per turn. */
  CODEX_APP_SERVER,
  /** Interactive {@code claude} on a pooled PTY. */
  CLAUDE_PTY,
  /** Interactive {@code codex --json} on a pooled PTY. */
  CODEX_PTY;

  /**
   * Parses {@code claude}, {@code codex-app-server} and similar names.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static Backend fromName(final String name) {
    if (name == null) {
      throw new IllegalArgumentException("backend name must not be null");
    }
    return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }
}
