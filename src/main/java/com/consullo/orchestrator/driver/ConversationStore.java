package com.consullo.orchestrator.driver;

import java.util.Optional;

/**
 * Persistence seam for conversation metadata. The engine reads and writes
 * nothing else.
 *
 * @since 1.0
 */
public interface ConversationStore {

  /**
   * Returns the most recent session of a conversation.
   *
   * @param ownerKey owner/conversation key
   * @return stored session, or empty for a new conversation
   */
  Optional<StoredSession> latestSession(String ownerKey);

  /**
   * Records the external session id reported by the latest turn.
   *
   * @param ownerKey owner/conversation key
   * @param externalSessionId id to resume next turn
   */
  void saveExternalSessionId(String ownerKey, String externalSessionId);
}
