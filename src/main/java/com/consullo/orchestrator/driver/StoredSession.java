package com.consullo.orchestrator.driver;

import org.apache.commons.lang3.Validate;

/**
 * Conversation metadata kept between turns.
 *
 * @param externalSessionId backend session or thread id to resume
 * @param mode backend mode last used by the conversation (may be null)
 * @since 1.0
 */
public record StoredSession(String externalSessionId, String mode) {

  public StoredSession {
    Validate.notBlank(externalSessionId, "externalSessionId must not be blank");
  }
}
