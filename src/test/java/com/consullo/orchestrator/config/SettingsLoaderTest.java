package com.consullo.orchestrator.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SettingsLoader}.
 *
 * @since 1.0
 */
public class SettingsLoaderTest {

  @Test
  @DisplayName("Should load the bundled defaults unchanged")
  void load_NoOverrides_MatchesDefaults() {
    final OrchestratorSettings settings = SettingsLoader.load(new Properties(), Map.of());

    assertThat(settings).isEqualTo(OrchestratorSettings.defaults());
    assertThat(settings.codex().defaultInstructionsFile()).isNull();
  }

  @Test
  @DisplayName("Should let properties override defaults and environment override both")
  void load_Layers_EnvironmentWins() {
    final Properties overrides = new Properties();
    overrides.setProperty("orchestrator.pty.max-sessions", "3");
    overrides.setProperty("orchestrator.claude.executable", "/opt/bin/claude");

    final OrchestratorSettings settings = SettingsLoader.load(overrides, Map.of(
            "ORCHESTRATOR_CLAUDE_EXECUTABLE", "/usr/local/bin/claude",
            "ORCHESTRATOR_CODEX_APPROVAL_MODE", "never",
            "ORCHESTRATOR_CODEX_DEFAULT_INSTRUCTIONS_FILE", "/etc/agents.md",
            "ORCHESTRATOR_EXECUTION_POLL_TICK", "PT0.25S"));

    assertThat(settings.pty().maxSessions()).isEqualTo(3);
    assertThat(settings.claude().executable()).isEqualTo("/usr/local/bin/claude");
    assertThat(settings.codex().isUnattended()).isTrue();
    assertThat(settings.codex().defaultInstructionsFile()).isEqualTo(Path.of("/etc/agents.md"));
    assertThat(settings.execution().pollTick()).isEqualTo(Duration.ofMillis(250));
  }

  @Test
  @DisplayName("Should split and trim list settings")
  void load_ListSetting_SplitAndTrimmed() {
    final Properties overrides = new Properties();
    overrides.setProperty("orchestrator.claude.allowed-models", " opus , sonnet ,,");

    final OrchestratorSettings settings = SettingsLoader.load(overrides, Map.of());

    assertThat(settings.claude().allowedModels()).containsExactly("opus", "sonnet");
  }

  @Test
  @DisplayName("Should map deprecated and unknown approval modes to on-request")
  void load_LegacyApprovalMode_Normalized() {
    final Properties overrides = new Properties();
    overrides.setProperty("orchestrator.codex.approval-mode", "on-failure");

    assertThat(SettingsLoader.load(overrides, Map.of()).codex().approvalMode()).isEqualTo("on-request");
  }

  @Test
  @DisplayName("Should name the offending key when a value does not parse")
  void load_BadValues_Rejected() {
    final Properties badDuration = new Properties();
    badDuration.setProperty("orchestrator.pty.read-tick", "100ms");
    final Properties badInteger = new Properties();
    badInteger.setProperty("orchestrator.pty.columns", "wide");

    assertThatThrownBy(() -> SettingsLoader.load(badDuration, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("orchestrator.pty.read-tick");
    assertThatThrownBy(() -> SettingsLoader.load(badInteger, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("orchestrator.pty.columns");
  }

  @Test
  @DisplayName("Should reject a default mode that is not allowed")
  void load_DefaultModeNotAllowed_Rejected() {
    final Properties overrides = new Properties();
    overrides.setProperty("orchestrator.claude.default-mode", "yolo");

    assertThatThrownBy(() -> SettingsLoader.load(overrides, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("yolo");
  }

  @Test
  @DisplayName("Should derive environment variable names from keys")
  void environmentName_ReplacesSeparators() {
    assertThat(SettingsLoader.environmentName("orchestrator.pty.max-sessions"))
            .isEqualTo("ORCHESTRATOR_PTY_MAX_SESSIONS");
  }
}
