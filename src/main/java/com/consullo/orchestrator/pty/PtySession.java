package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.config.PtySettings;
import com.consullo.orchestrator.exec.ExecutionResult;
import com.consullo.orchestrator.exec.MessageListener;
import com.consullo.orchestrator.exec.OneShotExecutor;
import com.consullo.orchestrator.stream.Message;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A long-lived interactive agent CLI running on a pseudo-terminal.
 *
 * <p>
 * A daemon thread copies PTY output into a queue; {@link #start()} and
 * {@link #send} consume it with timed polls on the caller's thread. One
 * {@code send} runs at a time: the session must be {@link PtySessionState#IDLE}
 * to accept a prompt.
 * </p>
 *
 * @since 1.0
 */
public class PtySession implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtySession.class);

  private static final byte[] END_OF_OUTPUT = new byte[0];
  private static final int READ_BUFFER_SIZE = 8192;
  private static final byte CTRL_C = 0x03;

  private final PtySessionConfig config;
  private final PtySettings settings;
  private final PtyProcessFactory processFactory;
  private final Clock clock;
  private final OutputFraming framing;
  private final BlockingQueue<byte[]> output = new LinkedBlockingQueue<>();
  private final Object stateLock = new Object();
  private final Object writeLock = new Object();
  private final Instant createdAt;

  private PtySessionState state = PtySessionState.STARTING;
  private volatile PtyProcessController controller;
  private volatile Instant lastActivityAt;
  private volatile boolean cancelRequested;
  private boolean stopClaimed;
  private Thread reader;

  public PtySession(
          final PtySessionConfig config,
          final PtySettings settings,
          final PtyProcessFactory processFactory,
          final int decoderBufferChars,
          final Clock clock) {
    this(config, settings, processFactory, clock,
            OutputFraming.create(config.outputMode(), settings.columns(), settings.rows(), decoderBufferChars, clock));
  }

  PtySession(
          final PtySessionConfig config,
          final PtySettings settings,
          final PtyProcessFactory processFactory,
          final Clock clock,
          final OutputFraming framing) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(settings, "settings must not be null");
    Validate.notNull(processFactory, "processFactory must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.config = config;
    this.settings = settings;
    this.processFactory = processFactory;
    this.clock = clock;
    this.framing = framing;
    this.createdAt = clock.instant();
    this.lastActivityAt = createdAt;
  }

  /**
   * Spawns the CLI and waits until it is ready for a prompt.
   *
   * @throws SessionStartException if the process cannot be spawned, exits, or
   * shows no readiness marker within the startup timeout
   */
  public void start() {
    synchronized (stateLock) {
      Validate.validState(state == PtySessionState.STARTING && controller == null,
              "PTY session %s was already started", config.key());
    }
    LOGGER.info("Starting PTY session {}: {}", config.key(), config.command());
    try {
      controller = processFactory.spawn(new PtyProcessConfig(
              config.command(),
              config.workingDirectory(),
              terminalEnvironment(),
              settings.columns(),
              settings.rows()));
      startReader(controller.getPtyOutput());
      final Instant deadline = clock.instant().plus(settings.startupTimeout());
      awaitReady(deadline);
      flushStartupOutput(deadline);
    } catch (SessionStartException e) {
      abort();
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      abort();
      throw new SessionStartException("Interrupted while starting PTY session " + config.key(), e);
    } catch (Exception e) {
      abort();
      throw new SessionStartException("Failed to start PTY session " + config.key() + ": " + e.getMessage(), e);
    }
    framing.beginTurn();
    transition(PtySessionState.IDLE);
    LOGGER.info("PTY session {} ready", config.key());
  }

  /**
   * Sends one prompt and collects the response.
   *
   * @param text prompt text; a carriage return is appended
   * @param listener receives decoded messages
   * @return outcome; a session that is not idle yields a failure result
   */
  public ExecutionResult send(final String text, final MessageListener listener) {
    Validate.notNull(text, "text must not be null");
    Validate.notNull(listener, "listener must not be null");
    synchronized (stateLock) {
      if (state != PtySessionState.IDLE) {
        return ExecutionResult.failure("Session not ready: " + state);
      }
      state = PtySessionState.BUSY;
    }
    cancelRequested = false;

    if (!discardPendingOutput()) {
      settle(PtySessionState.ERROR);
      return ExecutionResult.failure("PTY process exited");
    }
    framing.beginTurn();
    final Instant startedAt = clock.instant();
    touch();
    try {
      write((text + "\r").getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      LOGGER.warn("Writing prompt to PTY session {} failed: {}", config.key(), e.getMessage());
      settle(PtySessionState.ERROR);
      return ExecutionResult.failure("Failed to write to PTY: " + e.getMessage());
    }

    Message.Result result = null;
    String errorText = null;
    boolean sawOutput = false;
    Instant lastOutputAt = startedAt;
    try {
      while (true) {
        if (cancelRequested) {
          LOGGER.info("PTY send on {} cancelled", config.key());
          settle(PtySessionState.IDLE);
          return partial().success(false).wasCancelled(true).error("Cancelled").build();
        }
        final byte[] chunk = output.poll(settings.readTick().toMillis(), TimeUnit.MILLISECONDS);
        final Instant now = clock.instant();
        if (Duration.between(startedAt, now).compareTo(settings.callTimeout()) >= 0) {
          LOGGER.warn("PTY send on {} timed out after {}", config.key(), settings.callTimeout());
          settle(PtySessionState.ERROR);
          return partial().success(false)
                  .error("PTY call timed out after " + settings.callTimeout().toSeconds() + "s")
                  .build();
        }

        final List<Message> messages;
        if (chunk == null) {
          messages = framing.onQuiet();
        } else if (chunk == END_OF_OUTPUT) {
          LOGGER.warn("PTY session {} exited during a send", config.key());
          settle(PtySessionState.ERROR);
          return partial().success(false).error("PTY process exited").build();
        } else {
          sawOutput = true;
          lastOutputAt = now;
          touch();
          messages = framing.accept(chunk, chunk.length);
        }

        boolean finished = false;
        for (Message message : messages) {
          OneShotExecutor.deliver(listener, message, config.key());
          if (message instanceof Message.Result) {
            result = (Message.Result) message;
            if (result.error()) {
              errorText = result.errorText();
            }
          } else if (message instanceof Message.Error && message.isFinal()) {
            errorText = ((Message.Error) message).text();
          }
          finished |= message.isFinal();
        }
        if (finished) {
          break;
        }
        if (chunk == null && sawOutput
                && Duration.between(lastOutputAt, now).compareTo(settings.inactivityTimeout()) >= 0) {
          LOGGER.debug("PTY session {} quiet for {}; treating response as complete",
                  config.key(), settings.inactivityTimeout());
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      settle(PtySessionState.IDLE);
      return partial().success(false).wasCancelled(true).error("Cancelled").build();
    } catch (Exception e) {
      LOGGER.warn("PTY send on {} failed: {}", config.key(), e.getMessage(), e);
      settle(PtySessionState.ERROR);
      return partial().success(false).error(e.getMessage()).build();
    }

    settle(PtySessionState.IDLE);
    final ExecutionResult.Builder builder = partial();
    if (result != null) {
      if (!result.text().isEmpty()) {
        builder.text(result.text()).detailedText(result.detailedText());
      }
      builder.costUnits(result.costUnits()).durationMs(result.durationMs());
    }
    if (result == null || result.durationMs() == null) {
      builder.durationMs(Duration.between(startedAt, clock.instant()).toMillis());
    }
    return builder.success(errorText == null).error(errorText).build();
  }

  /**
   * Writes Ctrl-C to the CLI.
   *
   * @return true when the byte was written
   */
  public boolean interrupt() {
    if (!isAlive()) {
      return false;
    }
    try {
      write(new byte[] {CTRL_C});
      touch();
      return true;
    } catch (IOException e) {
      LOGGER.warn("Interrupting PTY session {} failed: {}", config.key(), e.getMessage());
      return false;
    }
  }

  /**
   * Interrupts the CLI and makes a running {@link #send} return as
   * cancelled.
   */
  public void cancelCurrent() {
    cancelRequested = true;
    interrupt();
  }

  /**
   * Stops the CLI: exit command, then Ctrl-C, then a forced kill, waiting the
   * stop grace after each step.
   */
  public void terminate() {
    synchronized (stateLock) {
      if (stopClaimed) {
        stopClaimed = false;
      } else if (state == PtySessionState.STOPPING || state == PtySessionState.STOPPED) {
        return;
      } else {
        state = PtySessionState.STOPPING;
      }
    }
    cancelRequested = true;
    final PtyProcessController c = controller;
    if (c != null) {
      try {
        if (c.isAlive()) {
          writeQuietly((settings.exitCommand() + "\r").getBytes(StandardCharsets.UTF_8));
          awaitExit(c);
        }
        if (c.isAlive()) {
          writeQuietly(new byte[] {CTRL_C});
          awaitExit(c);
        }
        if (c.isAlive()) {
          LOGGER.warn("PTY session {} ignored exit requests; killing", config.key());
          c.destroyForcibly();
          awaitExit(c);
        }
        c.close();
      } catch (Exception e) {
        LOGGER.warn("Error while stopping PTY session {}: {}", config.key(), e.getMessage(), e);
      }
    }
    if (reader != null) {
      reader.interrupt();
    }
    synchronized (stateLock) {
      state = PtySessionState.STOPPED;
    }
    LOGGER.info("Stopped PTY session {}", config.key());
  }

  /**
   * Moves an IDLE session to STOPPING in one step so no turn can start on it;
   * the caller then completes the stop with {@link #terminate()}.
   *
   * @return false when the session was not IDLE
   */
  public boolean claimForStop() {
    synchronized (stateLock) {
      if (state != PtySessionState.IDLE) {
        return false;
      }
      state = PtySessionState.STOPPING;
      stopClaimed = true;
      return true;
    }
  }

  @Override
  public void close() {
    terminate();
  }

  public boolean isAlive() {
    final PtyProcessController c = controller;
    if (c == null) {
      return false;
    }
    try {
      return c.isAlive();
    } catch (Exception e) {
      LOGGER.debug("Liveness check for PTY session {} failed: {}", config.key(), e.getMessage());
      return false;
    }
  }

  public PtySessionState state() {
    synchronized (stateLock) {
      return state;
    }
  }

  public String key() {
    return config.key();
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant lastActivityAt() {
    return lastActivityAt;
  }

  /**
   * External session id reported by the CLI, or null.
   */
  public String externalSessionId() {
    return framing.sessionId();
  }

  public SessionInfo describe() {
    int pid = -1;
    final PtyProcessController c = controller;
    if (c != null) {
      try {
        pid = c.pid();
      } catch (Exception e) {
        LOGGER.debug("Cannot read pid of PTY session {}: {}", config.key(), e.getMessage());
      }
    }
    return new SessionInfo(config.key(), state(), pid, isAlive(), config.outputMode(), createdAt, lastActivityAt);
  }

  private Map<String, String> terminalEnvironment() {
    final Map<String, String> env = new HashMap<>(config.environment());
    env.put("TERM", "xterm-256color");
    env.put("FORCE_COLOR", "1");
    env.put("COLUMNS", Integer.toString(settings.columns()));
    env.put("LINES", Integer.toString(settings.rows()));
    return env;
  }

  private void startReader(final InputStream in) {
    reader = new Thread(() -> {
      final byte[] buf = new byte[READ_BUFFER_SIZE];
      try {
        int n;
        while ((n = in.read(buf)) >= 0) {
          if (n > 0) {
            output.add(Arrays.copyOf(buf, n));
          }
        }
      } catch (IOException e) {
        LOGGER.debug("PTY output of {} closed: {}", config.key(), e.getMessage());
      } finally {
        output.add(END_OF_OUTPUT);
      }
    }, "PtyReadLoop-" + config.key());
    reader.setDaemon(true);
    reader.start();
  }

  /**
   * Waits for the first decodable message or a visible prompt.
   */
  private void awaitReady(final Instant deadline) throws Exception {
    while (clock.instant().isBefore(deadline)) {
      final byte[] chunk = output.poll(settings.readTick().toMillis(), TimeUnit.MILLISECONDS);
      final List<Message> messages;
      if (chunk == null) {
        messages = framing.onQuiet();
      } else if (chunk == END_OF_OUTPUT) {
        throw new SessionStartException("PTY process for " + config.key() + " exited during startup");
      } else {
        touch();
        messages = framing.accept(chunk, chunk.length);
      }
      if (!messages.isEmpty() || framing.promptVisible()) {
        return;
      }
    }
    throw new SessionStartException("PTY session " + config.key() + " not ready within "
            + settings.startupTimeout().toSeconds() + "s");
  }

  /**
   * Consumes boot output until the flush window passes without output.
   */
  private void flushStartupOutput(final Instant deadline) throws Exception {
    int flushed = 0;
    while (clock.instant().isBefore(deadline)) {
      final byte[] chunk = output.poll(settings.flushWindow().toMillis(), TimeUnit.MILLISECONDS);
      if (chunk == null) {
        break;
      }
      if (chunk == END_OF_OUTPUT) {
        throw new SessionStartException("PTY process for " + config.key() + " exited during startup");
      }
      flushed += chunk.length;
      framing.accept(chunk, chunk.length);
    }
    LOGGER.debug("Flushed {} bytes of startup output for {}", flushed, config.key());
  }

  /**
   * Feeds output that arrived between turns to the framing without reporting
   * it.
   *
   * @return false if the process output has ended
   */
  private boolean discardPendingOutput() {
    byte[] chunk;
    while ((chunk = output.poll()) != null) {
      if (chunk == END_OF_OUTPUT) {
        output.add(END_OF_OUTPUT);
        return false;
      }
      try {
        framing.accept(chunk, chunk.length);
      } catch (Exception e) {
        LOGGER.debug("Dropping undecodable idle output of {}: {}", config.key(), e.getMessage());
      }
    }
    return true;
  }

  private ExecutionResult.Builder partial() {
    return ExecutionResult.builder()
            .text(framing.plainText())
            .detailedText(framing.detailedText())
            .externalSessionId(framing.sessionId());
  }

  private void abort() {
    settle(PtySessionState.ERROR);
    final PtyProcessController c = controller;
    if (c == null) {
      return;
    }
    try {
      c.destroyForcibly();
      c.close();
    } catch (Exception e) {
      LOGGER.warn("Killing failed PTY session {} failed: {}", config.key(), e.getMessage());
    }
  }

  private void awaitExit(final PtyProcessController c) throws Exception {
    try {
      c.onExit().get(settings.stopGrace().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOGGER.debug("PTY session {} still running after {}", config.key(), settings.stopGrace());
    } catch (ExecutionException e) {
      LOGGER.debug("Exit monitor of {} failed: {}", config.key(), e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void write(final byte[] bytes) throws IOException {
    final PtyProcessController c = controller;
    if (c == null) {
      throw new IOException("PTY session " + config.key() + " has no process");
    }
    synchronized (writeLock) {
      try {
        final OutputStream in = c.getPtyInput();
        in.write(bytes);
        in.flush();
      } catch (IOException e) {
        throw e;
      } catch (Exception e) {
        throw new IOException(e.getMessage(), e);
      }
    }
  }

  private void writeQuietly(final byte[] bytes) {
    try {
      write(bytes);
    } catch (IOException e) {
      LOGGER.debug("Write to stopping PTY session {} failed: {}", config.key(), e.getMessage());
    }
  }

  private void touch() {
    lastActivityAt = clock.instant();
  }

  private void transition(final PtySessionState next) {
    synchronized (stateLock) {
      Validate.validState(state.canTransitionTo(next),
              "PTY session %s cannot move from %s to %s", config.key(), state, next);
      state = next;
    }
  }

  /**
   * Moves to {@code next} unless the session is already there or is being
   * stopped.
   */
  private void settle(final PtySessionState next) {
    synchronized (stateLock) {
      if (state == next || state == PtySessionState.STOPPING || state == PtySessionState.STOPPED) {
        return;
      }
      transition(next);
    }
  }
}
