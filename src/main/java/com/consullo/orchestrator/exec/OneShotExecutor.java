package com.consullo.orchestrator.exec;

import com.consullo.orchestrator.config.ExecutionTimeouts;
import com.consullo.orchestrator.stream.Message;
import com.consullo.orchestrator.stream.StreamDecoder;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one backend CLI process per execution and drives it to completion.
 *
 * <p>
 * Subclasses supply the command line and the backend's error vocabulary. This
 * class owns the shared lifecycle:
 * <ul>
 * <li>registry and state bookkeeping, always undone in {@code finally};</li>
 * <li>line reading under a read timeout, with cancellation observed each poll
 * tick;</li>
 * <li>control-event detection and early termination;</li>
 * <li>a bounded retry loop for expired sessions and rejected plan
 * finishes.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public abstract class OneShotExecutor implements AgentExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(OneShotExecutor.class);

  /** Upper bound on attempts for one {@link #execute} call. */
  public static final int MAX_RETRY_DEPTH = 3;

  private static final long STDERR_WAIT_MILLIS = 200L;

  private final String backendName;
  private final ProcessLauncher launcher;
  private final ProcessRegistry registry;
  private final ExecutionStateStore states;
  private final ExecutionTimeouts timeouts;
  private final int decoderBufferChars;
  private final Predicate<String> planTextClassifier;
  private final Clock clock;
  private final ControlEventDetector detector;
  private final ProcessTerminator terminator;

  protected OneShotExecutor(
          final String backendName,
          final ProcessLauncher launcher,
          final ProcessRegistry registry,
          final ExecutionStateStore states,
          final ExecutionTimeouts timeouts,
          final int decoderBufferChars,
          final Predicate<String> planTextClassifier,
          final Clock clock) {
    Validate.notBlank(backendName, "backendName must not be blank");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(registry, "registry must not be null");
    Validate.notNull(states, "states must not be null");
    Validate.notNull(timeouts, "timeouts must not be null");
    Validate.notNull(planTextClassifier, "planTextClassifier must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.backendName = backendName;
    this.launcher = launcher;
    this.registry = registry;
    this.states = states;
    this.timeouts = timeouts;
    this.decoderBufferChars = decoderBufferChars;
    this.planTextClassifier = planTextClassifier;
    this.clock = clock;
    this.detector = new ControlEventDetector(timeouts.planGracePeriod());
    this.terminator = new ProcessTerminator(timeouts.terminationGrace());
  }

  /**
   * Builds the command line for one attempt.
   *
   * @param request request with an already validated resume id
   * @param forceAutoApprove true when the attempt retries a rejected plan
   * finish
   * @return command and arguments, prompt last
   */
  protected abstract List<String> buildCommand(ExecutionRequest request, boolean forceAutoApprove);

  /**
   * True when {@code id} has the backend's external session id format.
   */
  protected abstract boolean isValidResumeId(String id);

  /**
   * True when {@code errorText} reports that the resumed session no longer
   * exists.
   */
  protected abstract boolean isSessionNotFound(String errorText);

  public final String backendName() {
    return backendName;
  }

  @Override
  public final ExecutionResult execute(final ExecutionRequest request, final MessageListener listener) {
    Validate.notNull(request, "request must not be null");
    Validate.notNull(listener, "listener must not be null");

    ExecutionRequest current = request;
    if (current.resumeSessionId() != null && !isValidResumeId(current.resumeSessionId())) {
      LOGGER.warn("Dropping malformed {} resume id '{}' for execution {}",
              backendName, current.resumeSessionId(), current.executionId());
      current = current.withResumeSessionId(null);
    }

    final CancellationScope scope = new CancellationScope();
    registry.register(current.executionId(), current.ownerKey(), scope);
    try {
      return runWithRetries(current, listener, scope);
    } finally {
      registry.deregister(current.executionId());
    }
  }

  private ExecutionResult runWithRetries(
          final ExecutionRequest request,
          final MessageListener listener,
          final CancellationScope scope) {
    ExecutionRequest current = request;
    boolean sessionRetryUsed = false;
    boolean autoApproveRetryUsed = false;
    boolean forceAutoApprove = false;
    Attempt attempt = null;

    for (int depth = 0; depth < MAX_RETRY_DEPTH; depth++) {
      if (scope.isRequested()) {
        LOGGER.info("{} execution {} cancelled before attempt {}", backendName, current.executionId(), depth + 1);
        final ExecutionResult.Builder cancelled = attempt != null ? attempt.result().toBuilder() : ExecutionResult.builder();
        return cancelled.success(false).wasCancelled(true).error("Cancelled").build();
      }
      attempt = runAttempt(current, forceAutoApprove, listener, scope);
      final ExecutionResult result = attempt.result();
      if (result.wasCancelled() || (result.isSuccess() && !attempt.planFailed())) {
        return result;
      }

      if (!sessionRetryUsed
              && current.resumeSessionId() != null
              && isSessionNotFound(attempt.diagnostics())) {
        sessionRetryUsed = true;
        LOGGER.info("{} session {} not found; retrying execution {} without resume (depth {})",
                backendName, current.resumeSessionId(), current.executionId(), depth + 1);
        current = current.withResumeSessionId(null);
        continue;
      }

      if (attempt.planFailed() && !autoApproveRetryUsed) {
        autoApproveRetryUsed = true;
        forceAutoApprove = true;
        final String sessionId = result.getExternalSessionId();
        if (sessionId != null && isValidResumeId(sessionId)) {
          current = current.withResumeSessionId(sessionId);
        }
        LOGGER.info("Finish-planning tool rejected; retrying execution {} with auto-approve on session {} (depth {})",
                current.executionId(), current.resumeSessionId(), depth + 1);
        continue;
      }
      return result;
    }

    LOGGER.error("Execution {} exceeded the retry depth of {}", request.executionId(), MAX_RETRY_DEPTH);
    return attempt.result().toBuilder()
            .success(false)
            .error("Max retry depth (" + MAX_RETRY_DEPTH + ") exceeded")
            .build();
  }

  @Override
  public boolean cancel(final String executionId) {
    return registry.cancel(executionId);
  }

  @Override
  public int cancelByOwner(final String ownerKey) {
    return registry.cancelByOwner(ownerKey);
  }

  private Attempt runAttempt(
          final ExecutionRequest request,
          final boolean forceAutoApprove,
          final MessageListener listener,
          final CancellationScope scope) {
    final String id = request.executionId();
    final List<String> command = buildCommand(request, forceAutoApprove);
    LOGGER.info("Starting {} for execution {} (resume={}, autoApprove={}, cwd={})",
            backendName, id, request.resumeSessionId(), forceAutoApprove, request.workingDirectory());

    final ExecutionState state = states.create(id);
    Process process = null;
    try {
      scope.attach(state::markCancelled);
      try {
        process = launcher.launch(command, request.workingDirectory());
      } catch (IOException e) {
        LOGGER.error("Failed to start {} for execution {}: {}", backendName, id, e.getMessage());
        return new Attempt(ExecutionResult.failure("Failed to start " + backendName + ": " + e.getMessage()), "", false);
      }

      final Process running = process;
      scope.attach(() -> {
        state.markCancelled();
        terminator.terminate(running);
      });
      return drive(running, state, listener);
    } finally {
      scope.detach();
      states.remove(id);
      if (process != null && process.isAlive()) {
        terminator.terminate(process);
      }
    }
  }

  private Attempt drive(final Process process, final ExecutionState state, final MessageListener listener) {
    final String id = state.executionId();
    final StreamDecoder decoder = new StreamDecoder(decoderBufferChars, clock);
    final LineChannel stdout = LineChannel.start(process.getInputStream(), backendName + "-stdout-" + id);
    final OutputCollector stderr = OutputCollector.start(process.getErrorStream(), backendName + "-stderr-" + id);
    closeStdin(process);

    Message.Result result = null;
    String errorText = null;
    boolean timedOut = false;
    ControlSignal stop = ControlSignal.NONE;
    Instant lastLineAt = clock.instant();

    try {
      readLoop:
      while (!state.isCancelled()) {
        final LineChannel.Line line = stdout.poll(timeouts.pollTick());
        final Instant now = clock.instant();
        if (line == null) {
          stop = detector.onTick(state, now);
          if (stop != ControlSignal.NONE) {
            break;
          }
          if (Duration.between(lastLineAt, now).compareTo(timeouts.readTimeout()) >= 0) {
            LOGGER.warn("{} execution {} produced no output for {}; terminating", backendName, id, timeouts.readTimeout());
            timedOut = true;
            break;
          }
          continue;
        }
        if (line.endOfStream()) {
          break;
        }
        lastLineAt = now;

        for (Message message : decoder.feed(line.text())) {
          deliver(listener, message, id);
          if (message instanceof Message.Result) {
            result = (Message.Result) message;
            if (result.error()) {
              errorText = result.errorText();
            }
          } else if (message instanceof Message.Error && message.isFinal()) {
            errorText = ((Message.Error) message).text();
          }

          stop = detector.inspect(message, state, now);
          if (stop != ControlSignal.NONE || message.isFinal()) {
            break readLoop;
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Execution {} interrupted; treating as cancellation", id);
      state.markCancelled();
    }

    final boolean cancelled = state.isCancelled();
    if (cancelled || timedOut || stop != ControlSignal.NONE) {
      terminator.terminate(process);
    } else {
      awaitExit(process);
    }
    final Integer exitCode = process.isAlive() ? null : process.exitValue();
    final String stderrText = stderr.text(STDERR_WAIT_MILLIS);

    final String text = result != null && !result.text().isEmpty() ? result.text() : decoder.plainText();
    final String detailed = result != null && !result.detailedText().isEmpty()
            ? result.detailedText()
            : decoder.detailedText();

    final ExecutionResult.Builder builder = ExecutionResult.builder()
            .text(text)
            .detailedText(detailed)
            .externalSessionId(decoder.sessionId())
            .costUnits(result != null ? result.costUnits() : null)
            .durationMs(result != null ? result.durationMs() : null);

    if (cancelled) {
      LOGGER.info("{} execution {} cancelled", backendName, id);
      return new Attempt(builder.success(false).wasCancelled(true).error("Cancelled").build(), "", false);
    }
    if (timedOut) {
      return new Attempt(builder.success(false)
              .error("No output from " + backendName + " for " + timeouts.readTimeout().toSeconds() + "s; process terminated")
              .build(), stderrText, false);
    }

    switch (stop) {
      case QUESTION:
        return new Attempt(builder.success(true).pendingQuestion(true).build(), "", false);
      case PLAN_READY:
        String candidate = state.planContentCandidate();
        if (candidate == null && !text.isBlank() && planTextClassifier.test(text)) {
          candidate = text;
        }
        return new Attempt(builder.success(true)
                .pendingPlanApproval(true)
                .planCandidateText(candidate)
                .planWriteTimedOut(state.isPlanWriteTimedOut())
                .build(), "", false);
      case PLAN_FAILED:
        return new Attempt(builder.success(false).error("Finish-planning tool failed").build(), stderrText, true);
      default:
        break;
    }

    if (errorText == null && result == null && exitCode != null && exitCode != 0) {
      errorText = !stderrText.isEmpty() ? stderrText : backendName + " exited with code " + exitCode;
    }
    LOGGER.info("{} execution {} finished (exit={}, error={})", backendName, id, exitCode, errorText != null);
    final String diagnostics = (errorText != null ? errorText : "") + "\n" + stderrText;
    return new Attempt(builder.success(errorText == null).error(errorText).build(), diagnostics, false);
  }

  private void awaitExit(final Process process) {
    try {
      if (!process.waitFor(timeouts.terminationGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.debug("{} process still running after its stream ended; terminating", backendName);
        terminator.terminate(process);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      terminator.terminate(process);
    }
  }

  private void closeStdin(final Process process) {
    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      LOGGER.debug("Closing {} stdin failed: {}", backendName, e.getMessage());
    }
  }

  public static void deliver(final MessageListener listener, final Message message, final String executionId) {
    try {
      listener.onMessage(message);
    } catch (Exception e) {
      LOGGER.warn("Message listener failed for execution {} on {}: {}",
              executionId, message.kind(), e.getMessage(), e);
    }
  }

  /**
   * Outcome of one attempt plus what the retry policy needs to know about it.
   *
   * @param result attempt result
   * @param diagnostics error and stderr text searched for retry markers
   * @param planFailed true when the finish-planning tool was rejected
   */
  private record Attempt(ExecutionResult result, String diagnostics, boolean planFailed) {
  }
}
