package com.consullo.orchestrator.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link OrchestratorSettings} from layered key/value sources.
 *
 * <p>
 * Layers, lowest precedence first: the bundled
 * {@value #DEFAULTS_RESOURCE} resource, caller-supplied properties, then
 * environment variables named after each key.
 * </p>
 *
 * @since 1.0
 */
public final class SettingsLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(SettingsLoader.class);

  public static final String DEFAULTS_RESOURCE = "orchestrator-defaults.properties";

  private final Properties merged;

  private SettingsLoader(final Properties merged) {
    this.merged = merged;
  }

  /**
   * Loads settings from the bundled defaults and the process environment.
   */
  public static OrchestratorSettings load() {
    return load(new Properties(), System.getenv());
  }

  /**
   * Loads settings from the bundled defaults, {@code overrides}, and
   * {@code environment}.
   *
   * @param overrides properties that replace bundled defaults
   * @param environment environment variables that replace both
   * @return settings
   */
  public static OrchestratorSettings load(final Properties overrides, final Map<String, String> environment) {
    Validate.notNull(overrides, "overrides must not be null");
    Validate.notNull(environment, "environment must not be null");

    final Properties merged = readDefaults();
    merged.putAll(overrides);
    for (String key : merged.stringPropertyNames()) {
      final String value = environment.get(environmentName(key));
      if (value != null) {
        LOGGER.debug("Setting {} overridden from environment", key);
        merged.setProperty(key, value);
      }
    }
    return new SettingsLoader(merged).build();
  }

  /**
   * Maps a property key to its environment variable name.
   */
  public static String environmentName(final String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  private static Properties readDefaults() {
    final Properties props = new Properties();
    try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
      }
      props.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed reading " + DEFAULTS_RESOURCE, e);
    }
    return props;
  }

  private OrchestratorSettings build() {
    final ExecutionTimeouts execution = new ExecutionTimeouts(
        duration("orchestrator.execution.read-timeout"),
        duration("orchestrator.execution.poll-tick"),
        duration("orchestrator.execution.termination-grace"),
        duration("orchestrator.execution.plan-grace-period"),
        duration("orchestrator.execution.callback-timeout"));

    final ClaudeSettings claude = new ClaudeSettings(
        string("orchestrator.claude.executable"),
        string("orchestrator.claude.default-mode"),
        list("orchestrator.claude.allowed-modes"),
        string("orchestrator.claude.auto-approve-mode"),
        string("orchestrator.claude.default-model"),
        list("orchestrator.claude.allowed-models"));

    final String instructions = string("orchestrator.codex.default-instructions-file");
    final CodexSettings codex = new CodexSettings(
        string("orchestrator.codex.executable"),
        string("orchestrator.codex.default-sandbox"),
        list("orchestrator.codex.allowed-sandboxes"),
        string("orchestrator.codex.approval-mode"),
        string("orchestrator.codex.default-model"),
        list("orchestrator.codex.allowed-models"),
        instructions.isEmpty() ? null : Path.of(instructions));

    final PtySettings pty = new PtySettings(
        duration("orchestrator.pty.startup-timeout"),
        duration("orchestrator.pty.inactivity-timeout"),
        duration("orchestrator.pty.read-tick"),
        duration("orchestrator.pty.call-timeout"),
        duration("orchestrator.pty.idle-timeout"),
        duration("orchestrator.pty.stop-grace"),
        duration("orchestrator.pty.flush-window"),
        integer("orchestrator.pty.columns"),
        integer("orchestrator.pty.rows"),
        duration("orchestrator.pty.sweep-interval"),
        integer("orchestrator.pty.max-sessions"),
        string("orchestrator.pty.exit-command"));

    return new OrchestratorSettings(execution, claude, codex, pty, integer("orchestrator.decoder.max-buffer-chars"));
  }

  private String string(final String key) {
    final String value = merged.getProperty(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing setting " + key);
    }
    return value.trim();
  }

  private List<String> list(final String key) {
    final List<String> out = new ArrayList<>();
    for (String part : StringUtils.split(string(key), ',')) {
      final String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        out.add(trimmed);
      }
    }
    return out;
  }

  private int integer(final String key) {
    final String value = string(key);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Setting " + key + " is not an integer: " + value, e);
    }
  }

  private Duration duration(final String key) {
    final String value = string(key);
    try {
      return Duration.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Setting " + key + " is not an ISO-8601 duration: " + value, e);
    }
  }
}
