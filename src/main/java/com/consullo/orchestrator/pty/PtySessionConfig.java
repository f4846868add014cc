package com.consullo.orchestrator.pty;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * What to run in a pooled PTY session and how to read its output.
 *
 * @param key pool key (owner/conversation key)
 * @param command interactive CLI command and arguments
 * @param workingDirectory working directory of the CLI
 * @param environment extra environment variables (may be empty)
 * @param outputMode output framing
 * @since 1.0
 */
public record PtySessionConfig(
    String key,
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    OutputMode outputMode) {

  public PtySessionConfig {
    Validate.notBlank(key, "key must not be blank");
    Validate.notEmpty(command, "command must not be empty");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.notNull(outputMode, "outputMode must not be null");
    command = List.copyOf(command);
    environment = environment != null ? Map.copyOf(environment) : Map.of();
  }
}
