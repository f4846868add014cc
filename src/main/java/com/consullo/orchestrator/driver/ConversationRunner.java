package com.consullo.orchestrator.driver;

import com.consullo.orchestrator.exec.AgentExecutor;
import com.consullo.orchestrator.exec.ExecutionRequest;
import com.consullo.orchestrator.exec.ExecutionResult;
import com.consullo.orchestrator.exec.MessageListener;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs conversation turns: resumes the stored external session, executes the
 * prompt and remembers the session id the backend reports.
 *
 * @since 1.0
 */
public final class ConversationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversationRunner.class);

  private final AgentExecutor executor;
  private final ConversationStore store;

  public ConversationRunner(final AgentExecutor executor, final ConversationStore store) {
    Validate.notNull(executor, "executor must not be null");
    Validate.notNull(store, "store must not be null");
    this.executor = executor;
    this.store = store;
  }

  /**
   * Executes one turn of a conversation.
   *
   * @param ownerKey owner/conversation key
   * @param prompt prompt text
   * @param workingDirectory working directory of the backend
   * @param model requested model (may be null)
   * @param listener receives decoded messages
   * @return outcome of the turn
   */
  public ExecutionResult run(
          final String ownerKey,
          final String prompt,
          final Path workingDirectory,
          final String model,
          final MessageListener listener) {
    Validate.notBlank(ownerKey, "ownerKey must not be blank");

    final Optional<StoredSession> stored = store.latestSession(ownerKey);
    final String resumeId = stored.map(StoredSession::externalSessionId).orElse(null);
    final ExecutionRequest request = ExecutionRequest.builder()
            .prompt(prompt)
            .workingDirectory(workingDirectory)
            .resumeSessionId(resumeId)
            .mode(stored.map(StoredSession::mode).orElse(null))
            .model(model)
            .executionId(UUID.randomUUID().toString())
            .ownerKey(ownerKey)
            .build();
    LOGGER.info("Running turn {} for {} (resume: {})", request.executionId(), ownerKey, resumeId);

    final ExecutionResult result = executor.execute(request, listener);

    final String newId = result.getExternalSessionId();
    if (newId != null && !newId.isBlank() && !Objects.equals(newId, resumeId)) {
      store.saveExternalSessionId(ownerKey, newId);
      LOGGER.debug("Conversation {} now resumes session {}", ownerKey, newId);
    }
    return result;
  }

  /**
   * Cancels every running turn of a conversation.
   *
   * @return number of executions signalled
   */
  public int cancel(final String ownerKey) {
    return executor.cancelByOwner(ownerKey);
  }
}
