package com.consullo.orchestrator.rpc;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ApprovalDecisionsTest {

  @Test
  @DisplayName("Should use each method family's own decision words")
  void payload_MethodFamilies_UseMatchingVocabulary() {
    assertThat(ApprovalDecisions.payload("item/fileChange/requestApproval", true).get("decision").asText())
            .isEqualTo("accept");
    assertThat(ApprovalDecisions.payload(ApprovalDecisions.SKILL_APPROVAL, false).get("decision").asText())
            .isEqualTo("decline");
    assertThat(ApprovalDecisions.payload("execCommandApproval", true).get("decision").asText())
            .isEqualTo("approved");
    assertThat(ApprovalDecisions.payload("applyPatchApproval", false).get("decision").asText())
            .isEqualTo("denied");
  }

  @Test
  @DisplayName("Should only accept decisions drawn from the method's vocabulary")
  void isValid_ForeignWords_Rejected() {
    final JsonNodeFactory nodes = JsonNodeFactory.instance;
    assertThat(ApprovalDecisions.isValid("execCommandApproval", nodes.objectNode().put("decision", "approved")))
            .isTrue();
    assertThat(ApprovalDecisions.isValid("execCommandApproval", nodes.objectNode().put("decision", "accept")))
            .isFalse();
    assertThat(ApprovalDecisions.isValid("item/commandExecution/requestApproval", nodes.textNode("accept")))
            .isFalse();
    assertThat(ApprovalDecisions.isValid("item/commandExecution/requestApproval", null)).isFalse();
  }

  @Test
  @DisplayName("Should recognise approval methods regardless of surrounding whitespace")
  void isApprovalMethod_KnownAndUnknown() {
    assertThat(ApprovalDecisions.isApprovalMethod(" item/commandExecution/requestApproval ")).isTrue();
    assertThat(ApprovalDecisions.isApprovalMethod("item/tool/requestUserInput")).isFalse();
    assertThat(ApprovalDecisions.isApprovalMethod(null)).isFalse();
  }

  @Test
  @DisplayName("Should approve by default only when unattended")
  void defaultPayload_DependsOnUnattended() {
    assertThat(ApprovalDecisions.defaultPayload(ApprovalDecisions.SKILL_APPROVAL, true).get("decision").asText())
            .isEqualTo("approve");
    assertThat(ApprovalDecisions.defaultPayload(ApprovalDecisions.SKILL_APPROVAL, false).get("decision").asText())
            .isEqualTo("decline");
  }
}
