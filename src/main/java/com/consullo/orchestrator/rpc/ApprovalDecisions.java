package com.consullo.orchestrator.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Set;

/**
 * Decision vocabulary of the app-server approval requests.
 *
 * @since 1.0
 */
public final class ApprovalDecisions {

  public static final String SKILL_APPROVAL = "skill/requestApproval";
  public static final Set<String> LEGACY_APPROVALS = Set.of("execCommandApproval", "applyPatchApproval");

  /** Server request methods that ask for an approval decision. */
  public static final Set<String> APPROVAL_METHODS = Set.of(
      "item/commandExecution/requestApproval",
      "item/fileChange/requestApproval",
      SKILL_APPROVAL,
      "execCommandApproval",
      "applyPatchApproval");

  private ApprovalDecisions() {
  }

  public static boolean isApprovalMethod(final String method) {
    return method != null && APPROVAL_METHODS.contains(method.trim());
  }

  /**
   * Returns the {approve, reject} decision words for {@code method}.
   */
  public static List<String> vocabulary(final String method) {
    final String m = method != null ? method.trim() : "";
    if (SKILL_APPROVAL.equals(m)) {
      return List.of("approve", "decline");
    }
    if (LEGACY_APPROVALS.contains(m)) {
      return List.of("approved", "denied");
    }
    return List.of("accept", "decline");
  }

  /**
   * Builds the decision payload for a yes/no answer.
   */
  public static ObjectNode payload(final String method, final boolean approved) {
    final List<String> words = vocabulary(method);
    final ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("decision", approved ? words.get(0) : words.get(1));
    return node;
  }

  /**
   * Default decision when no valid answer is available: approve only when the
   * bridge runs unattended.
   */
  public static ObjectNode defaultPayload(final String method, final boolean unattended) {
    return payload(method, unattended);
  }

  /**
   * True when {@code decision} is an object whose {@code decision} field uses
   * the method's vocabulary.
   */
  public static boolean isValid(final String method, final JsonNode decision) {
    if (decision == null || !decision.isObject()) {
      return false;
    }
    final JsonNode word = decision.get("decision");
    return word != null && word.isTextual() && vocabulary(method).contains(word.asText());
  }
}
