package com.consullo.orchestrator.driver;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.Validate;

/**
 * Process-local {@link ConversationStore}.
 *
 * @since 1.0
 */
public final class InMemoryConversationStore implements ConversationStore {

  private final Map<String, StoredSession> sessions = new ConcurrentHashMap<>();

  @Override
  public Optional<StoredSession> latestSession(final String ownerKey) {
    Validate.notBlank(ownerKey, "ownerKey must not be blank");
    return Optional.ofNullable(sessions.get(ownerKey));
  }

  @Override
  public void saveExternalSessionId(final String ownerKey, final String externalSessionId) {
    Validate.notBlank(ownerKey, "ownerKey must not be blank");
    sessions.compute(ownerKey, (key, previous) ->
            new StoredSession(externalSessionId, previous != null ? previous.mode() : null));
  }

  /**
   * Sets the mode used by later turns of a conversation that already has a
   * session.
   *
   * @return false when the conversation has no stored session
   */
  public boolean updateMode(final String ownerKey, final String mode) {
    return sessions.computeIfPresent(ownerKey,
            (key, previous) -> new StoredSession(previous.externalSessionId(), mode)) != null;
  }
}
