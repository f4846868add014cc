package com.consullo.orchestrator.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;

/**
 * Decides approval requests raised by the agent (commands, file changes,
 * skills).
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ApprovalCallback {

  /**
   * Requests an approval decision.
   *
   * @param method server request method
   * @param payload request params
   * @return future decision object {@code {"decision": "..."}}; a missing or
   * invalid decision is replaced by the configured default
   */
  CompletableFuture<JsonNode> onApprovalRequest(String method, JsonNode payload);
}
