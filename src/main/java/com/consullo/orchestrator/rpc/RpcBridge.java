package com.consullo.orchestrator.rpc;

import com.consullo.orchestrator.config.CodexSettings;
import com.consullo.orchestrator.config.ExecutionTimeouts;
import com.consullo.orchestrator.exec.AgentExecutor;
import com.consullo.orchestrator.exec.CancellationScope;
import com.consullo.orchestrator.exec.CliArguments;
import com.consullo.orchestrator.exec.CodexExecutor;
import com.consullo.orchestrator.exec.ExecutionRequest;
import com.consullo.orchestrator.exec.ExecutionResult;
import com.consullo.orchestrator.exec.MessageListener;
import com.consullo.orchestrator.exec.ModelSpec;
import com.consullo.orchestrator.exec.OneShotExecutor;
import com.consullo.orchestrator.exec.OutputCollector;
import com.consullo.orchestrator.exec.ProcessLauncher;
import com.consullo.orchestrator.exec.ProcessRegistry;
import com.consullo.orchestrator.exec.ProcessTerminator;
import com.consullo.orchestrator.stream.Message;
import com.consullo.orchestrator.stream.StreamDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executor over the item/event backend's JSON-RPC app-server.
 *
 * <p>
 * Each execution spawns {@code <executable> app-server --listen stdio://},
 * opens or resumes a thread, starts one turn and pumps notifications until the
 * turn ends. Server requests for user input and approvals are routed to the
 * callbacks; unanswered or malformed answers fall back to safe defaults.
 * </p>
 *
 * @since 1.0
 */
public final class RpcBridge implements AgentExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RpcBridge.class);

  public static final String CLIENT_NAME = "consullo_agent_orchestrator";
  public static final String CLIENT_TITLE = "Consullo Agent Orchestrator";
  public static final String CLIENT_VERSION = "1.0.0";

  static final String USER_INPUT_METHOD = "item/tool/requestUserInput";

  private final CodexSettings settings;
  private final ProcessLauncher launcher;
  private final ProcessRegistry registry;
  private final ExecutionTimeouts timeouts;
  private final int decoderBufferChars;
  private final UserInputCallback userInputCallback;
  private final ApprovalCallback approvalCallback;
  private final Clock clock;
  private final ObjectMapper mapper = new ObjectMapper();
  private final ProcessTerminator terminator;

  public RpcBridge(
          final CodexSettings settings,
          final ProcessLauncher launcher,
          final ProcessRegistry registry,
          final ExecutionTimeouts timeouts,
          final int decoderBufferChars,
          final UserInputCallback userInputCallback,
          final ApprovalCallback approvalCallback,
          final Clock clock) {
    Validate.notNull(settings, "settings must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(registry, "registry must not be null");
    Validate.notNull(timeouts, "timeouts must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.settings = settings;
    this.launcher = launcher;
    this.registry = registry;
    this.timeouts = timeouts;
    this.decoderBufferChars = decoderBufferChars;
    this.userInputCallback = userInputCallback;
    this.approvalCallback = approvalCallback;
    this.clock = clock;
    this.terminator = new ProcessTerminator(timeouts.terminationGrace());
  }

  @Override
  public ExecutionResult execute(final ExecutionRequest request, final MessageListener listener) {
    Validate.notNull(request, "request must not be null");
    Validate.notNull(listener, "listener must not be null");

    ExecutionRequest current = request;
    if (current.resumeSessionId() != null && !CliArguments.isOpaqueId(current.resumeSessionId())) {
      LOGGER.warn("Dropping malformed thread id '{}' for execution {}",
              current.resumeSessionId(), current.executionId());
      current = current.withResumeSessionId(null);
    }
    final String instructions = readDefaultInstructions();

    final CancellationScope scope = new CancellationScope();
    registry.register(current.executionId(), current.ownerKey(), scope);
    try {
      return runWithRetry(current, listener, instructions, scope);
    } finally {
      registry.deregister(current.executionId());
    }
  }

  private ExecutionResult runWithRetry(
          final ExecutionRequest request,
          final MessageListener listener,
          final String instructions,
          final CancellationScope scope) {
    ExecutionRequest current = request;
    boolean freshThreadRetryUsed = false;
    Session session = null;
    for (int depth = 0; depth < OneShotExecutor.MAX_RETRY_DEPTH; depth++) {
      if (scope.isRequested()) {
        LOGGER.info("RPC execution {} cancelled before attempt {}", current.executionId(), depth + 1);
        final ExecutionResult.Builder cancelled = session != null
                ? session.result().toBuilder()
                : ExecutionResult.builder();
        return cancelled.success(false).wasCancelled(true).error("Cancelled").build();
      }
      session = runSession(current, listener, instructions, scope);
      if (session.threadMissing() && !freshThreadRetryUsed) {
        freshThreadRetryUsed = true;
        LOGGER.info("Thread {} not found; retrying execution {} on a fresh thread",
                current.resumeSessionId(), current.executionId());
        current = current.withResumeSessionId(null);
        continue;
      }
      return session.result();
    }
    return session.result().toBuilder()
            .success(false)
            .error("Max retry depth (" + OneShotExecutor.MAX_RETRY_DEPTH + ") exceeded")
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

  private Session runSession(
          final ExecutionRequest request,
          final MessageListener listener,
          final String instructions,
          final CancellationScope scope) {
    final String id = request.executionId();
    final List<String> command = List.of(settings.executable(), "app-server", "--listen", "stdio://");
    LOGGER.info("Starting app-server for execution {} (resume={}, cwd={})",
            id, request.resumeSessionId(), request.workingDirectory());

    final AtomicBoolean cancelled = new AtomicBoolean();
    scope.attach(() -> cancelled.set(true));
    final Process process;
    try {
      process = launcher.launch(command, request.workingDirectory());
    } catch (IOException e) {
      LOGGER.error("Failed to start app-server for execution {}: {}", id, e.getMessage());
      scope.detach();
      return new Session(ExecutionResult.failure("Failed to start codex app-server: " + e.getMessage()), false);
    }

    final StreamDecoder decoder = new StreamDecoder(decoderBufferChars, clock);
    final NotificationTranslator translator = new NotificationTranslator(
            decoder, message -> OneShotExecutor.deliver(listener, message, id));
    final OutputCollector stderr = OutputCollector.start(process.getErrorStream(), "codex-rpc-stderr-" + id);
    final RpcChannel channel = new RpcChannel(process, mapper, timeouts, clock, "codex-rpc-" + id,
            (method, params) -> handleServerRequest(method, params, translator, cancelled));

    try {
      scope.attach(() -> {
        cancelled.set(true);
        channel.cancel();
        terminator.terminate(process);
      });
      return converse(request, instructions, channel, translator, decoder);
    } catch (CancellationException e) {
      LOGGER.info("RPC execution {} cancelled", id);
      return new Session(partial(decoder).success(false).wasCancelled(true).error("Cancelled").build(), false);
    } catch (RpcException e) {
      LOGGER.warn("RPC execution {} failed: {}", id, e.getMessage());
      final String stderrText = stderr.text(200L);
      final String error = stderrText.isEmpty() ? e.getMessage() : e.getMessage() + "\n" + stderrText;
      return new Session(partial(decoder).success(false).error(error).build(), false);
    } finally {
      scope.detach();
      channel.close();
      terminator.terminate(process);
    }
  }

  private Session converse(
          final ExecutionRequest request,
          final String instructions,
          final RpcChannel channel,
          final NotificationTranslator translator,
          final StreamDecoder decoder) throws RpcException {
    channel.call("initialize", initializeParams());
    channel.notify("initialized", null);

    final String resumeId = request.resumeSessionId();
    final ModelSpec model = CodexExecutor.resolveModel(settings, request.model());
    final JsonNode threadResult;
    try {
      threadResult = channel.call(resumeId != null ? "thread/resume" : "thread/start",
              threadParams(request, model));
    } catch (RpcException e) {
      if (resumeId != null
              && CliArguments.containsAnyIgnoreCase(e.getMessage(), CodexExecutor.SESSION_NOT_FOUND_MARKERS)) {
        return new Session(partial(decoder).success(false).error(e.getMessage()).build(), true);
      }
      throw e;
    }

    final String threadId = threadResult.path("thread").path("id").asText(resumeId != null ? resumeId : "");
    translator.threadStarted(threadId);

    final Instant turnStartedAt = clock.instant();
    channel.call("turn/start", turnParams(threadId, instructions + request.prompt(), model));

    Message terminal = null;
    while (terminal == null) {
      final JsonNode notification = channel.nextNotification();
      if (notification == null) {
        throw new RpcException("app-server exited before the turn completed");
      }
      terminal = translator.onNotification(notification);
    }

    final ExecutionResult.Builder builder = partial(decoder);
    if (terminal instanceof Message.Result) {
      final Message.Result result = (Message.Result) terminal;
      final long elapsed = clock.millis() - turnStartedAt.toEpochMilli();
      builder.text(result.text().isEmpty() ? decoder.plainText() : result.text())
              .detailedText(result.detailedText().isEmpty() ? decoder.detailedText() : result.detailedText())
              .costUnits(result.costUnits())
              .durationMs(result.durationMs() != null ? result.durationMs() : elapsed);
      if (result.error()) {
        return new Session(builder.success(false).error(result.errorText()).build(), false);
      }
      LOGGER.info("RPC execution {} completed on thread {}", request.executionId(), threadId);
      return new Session(builder.success(true).build(), false);
    }
    final String error = terminal instanceof Message.Error ? ((Message.Error) terminal).text() : "Turn failed";
    return new Session(builder.success(false).error(error).build(), false);
  }

  private ExecutionResult.Builder partial(final StreamDecoder decoder) {
    return ExecutionResult.builder()
            .text(decoder.plainText())
            .detailedText(decoder.detailedText())
            .externalSessionId(decoder.sessionId());
  }

  private JsonNode handleServerRequest(
          final String method,
          final JsonNode params,
          final NotificationTranslator translator,
          final AtomicBoolean cancelled) throws RpcException {
    if (USER_INPUT_METHOD.equals(method)) {
      final String itemId = params.path("itemId").asText("");
      final JsonNode questions = params.has("questions") ? params.get("questions") : mapper.createArrayNode();
      translator.userInputRequested(itemId, questions);
      final ObjectNode payload = mapper.createObjectNode();
      payload.set("questions", questions);
      JsonNode answer = userInputCallback != null
              ? await(() -> userInputCallback.onUserInputRequest(itemId, payload), method, cancelled)
              : null;
      if (answer == null || !answer.isObject()) {
        if (answer != null) {
          LOGGER.warn("Ignoring non-object user input answer for item {}", itemId);
        }
        final ObjectNode empty = mapper.createObjectNode();
        empty.putObject("answers");
        answer = empty;
      }
      translator.userInputAnswered(itemId, answer);
      return answer;
    }
    if (ApprovalDecisions.isApprovalMethod(method)) {
      final JsonNode decision = approvalCallback != null
              ? await(() -> approvalCallback.onApprovalRequest(method, params), method, cancelled)
              : null;
      if (ApprovalDecisions.isValid(method, decision)) {
        return decision;
      }
      if (decision != null) {
        LOGGER.warn("Invalid decision {} for {}; using default", decision, method);
      }
      return ApprovalDecisions.defaultPayload(method, settings.isUnattended());
    }
    LOGGER.warn("Rejecting unsupported server request {}", method);
    throw new RpcException("Method not found: " + method, JsonRpcMessage.METHOD_NOT_FOUND);
  }

  /**
   * Invokes a callback and waits for its answer in poll-tick slices so
   * cancellation is seen.
   *
   * @return the answer, or null when the callback threw, failed or timed out
   */
  private JsonNode await(
          final Supplier<CompletableFuture<JsonNode>> callback,
          final String method,
          final AtomicBoolean cancelled) {
    final CompletableFuture<JsonNode> future;
    try {
      future = callback.get();
    } catch (RuntimeException e) {
      LOGGER.warn("Callback for {} threw; using default", method, e);
      return null;
    }
    if (future == null) {
      return null;
    }
    final long deadline = clock.millis() + timeouts.callbackTimeout().toMillis();
    while (true) {
      if (cancelled.get()) {
        future.cancel(true);
        throw new CancellationException("Cancelled while waiting for " + method);
      }
      try {
        return future.get(timeouts.pollTick().toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        if (clock.millis() >= deadline) {
          LOGGER.warn("No answer for {} within {}; using default", method, timeouts.callbackTimeout());
          future.cancel(true);
          return null;
        }
      } catch (ExecutionException e) {
        LOGGER.warn("Callback for {} failed: {}", method, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        return null;
      } catch (CancellationException e) {
        LOGGER.warn("Callback for {} was cancelled; using default", method);
        return null;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelled.set(true);
        throw new CancellationException("Interrupted while waiting for " + method);
      }
    }
  }

  private ObjectNode initializeParams() {
    final ObjectNode params = mapper.createObjectNode();
    final ObjectNode clientInfo = params.putObject("clientInfo");
    clientInfo.put("name", CLIENT_NAME);
    clientInfo.put("title", CLIENT_TITLE);
    clientInfo.put("version", CLIENT_VERSION);
    return params;
  }

  private ObjectNode threadParams(final ExecutionRequest request, final ModelSpec model) {
    final ObjectNode params = mapper.createObjectNode();
    if (request.resumeSessionId() != null) {
      params.put("threadId", request.resumeSessionId());
    }
    params.put("cwd", request.workingDirectory().toString());
    params.put("approvalPolicy", settings.approvalMode());
    params.put("sandbox", CliArguments.allowedOrDefault(
            "sandbox mode", request.mode(), settings.allowedSandboxes(), settings.defaultSandbox()));
    if (model.hasModel()) {
      params.put("model", model.baseModel());
    }
    return params;
  }

  private ObjectNode turnParams(final String threadId, final String text, final ModelSpec model) {
    final ObjectNode params = mapper.createObjectNode();
    params.put("threadId", threadId);
    final ObjectNode input = params.putArray("input").addObject();
    input.put("type", "text");
    input.put("text", text);
    if (model.effort() != null) {
      params.put("effort", model.effort());
    }
    return params;
  }

  /**
   * Returns the configured default instructions followed by a paragraph break,
   * or an empty string.
   */
  private String readDefaultInstructions() {
    if (settings.defaultInstructionsFile() == null) {
      return "";
    }
    try {
      final String text = Files.readString(settings.defaultInstructionsFile(), StandardCharsets.UTF_8).strip();
      return text.isEmpty() ? "" : text + "\n\n";
    } catch (IOException e) {
      LOGGER.warn("Cannot read default instructions {}: {}", settings.defaultInstructionsFile(), e.getMessage());
      return "";
    }
  }

  /**
   * Outcome of one app-server process.
   *
   * @param result execution result
   * @param threadMissing true when the resumed thread no longer exists
   */
  private record Session(ExecutionResult result, boolean threadMissing) {
  }
}
