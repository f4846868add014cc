package com.consullo.orchestrator.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Spawns backend processes with piped stdio.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ProcessLauncher {

  /**
   * Starts a process.
   *
   * @param command command and arguments
   * @param workingDirectory working directory
   * @return started process
   * @throws IOException if the process cannot be started
   */
  Process launch(List<String> command, Path workingDirectory) throws IOException;

  /**
   * Launcher backed by {@link ProcessBuilder}, inheriting the current
   * environment plus {@code extraEnvironment}.
   */
  static ProcessLauncher system(final Map<String, String> extraEnvironment) {
    return (command, workingDirectory) -> {
      final ProcessBuilder builder = new ProcessBuilder(command);
      builder.directory(workingDirectory.toFile());
      if (extraEnvironment != null) {
        builder.environment().putAll(extraEnvironment);
      }
      return builder.start();
    };
  }
}
