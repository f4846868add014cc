package com.consullo.orchestrator.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PTY controller implemented with pty4j.
 *
 * <p>The child inherits the current environment plus
 * {@link PtyProcessConfig#environment()}, and starts at the configured window
 * size so full-screen CLIs lay out correctly from their first frame.
 *
 * @since 1.0
 */
public final class PtyProcessControllerPty4j implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessControllerPty4j.class);

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();

  /**
   * Spawns a PTY-attached process.
   *
   * @param config process configuration (command, working directory, environment, initial size)
   * @throws Exception if process cannot be started
   */
  public PtyProcessControllerPty4j(final PtyProcessConfig config) throws Exception {
    Validate.notNull(config, "config must not be null");

    final Map<String, String> env = new HashMap<>(System.getenv());
    env.putAll(config.environment());

    final PtyProcessBuilder builder = new PtyProcessBuilder(config.command().toArray(new String[0]))
            .setDirectory(config.workingDirectory().toString())
            .setEnvironment(env)
            .setInitialColumns(config.initialColumns())
            .setInitialRows(config.initialRows())
            .setRedirectErrorStream(true);

    this.process = builder.start();
    LOGGER.info("Spawned PTY process {} (pid {}) in {}",
            config.command().get(0), this.process.pid(), config.workingDirectory());
    startExitMonitorThread();
  }

  @Override
  public InputStream getPtyOutput() throws Exception {
    return this.process.getInputStream();
  }

  @Override
  public OutputStream getPtyInput() throws Exception {
    return this.process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) throws Exception {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");

    try {
      this.process.setWinSize(new WinSize(columns, rows));
    } catch (final Exception e) {
      LOGGER.warn("PTY resize failed: {}", e.getMessage(), e);
      throw e;
    }
  }

  @Override
  public CompletableFuture<Integer> onExit() throws Exception {
    return this.exitFuture;
  }

  @Override
  public int pid() throws Exception {
    return (int) this.process.pid();
  }

  @Override
  public boolean isAlive() throws Exception {
    return this.process.isAlive();
  }

  @Override
  public void destroyForcibly() throws Exception {
    this.process.destroyForcibly();
  }

  @Override
  public void close() throws Exception {
    this.process.destroy();
    if (!this.process.isAlive() && !this.exitFuture.isDone()) {
      this.exitFuture.complete(this.process.exitValue());
    }
  }

  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        this.exitFuture.complete(this.process.waitFor());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        this.exitFuture.completeExceptionally(e);
      }
    }, "PtyProcessExitMonitor");
    monitor.setDaemon(true);
    monitor.start();
  }
}
