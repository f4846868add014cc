package com.consullo.orchestrator.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;

/**
 * Answers free-form input requests raised by the agent.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface UserInputCallback {

  /**
   * Requests human input.
   *
   * @param itemId id of the requesting item
   * @param payload request payload, {@code {"questions": [...]}}
   * @return future answer object (for example {@code {"answers": {...}}}); a
   * null, failed or non-object answer is replaced by an empty answer set
   */
  CompletableFuture<JsonNode> onUserInputRequest(String itemId, JsonNode payload);
}
