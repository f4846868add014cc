package com.consullo.orchestrator.pty;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PromptDetectorTest {

  @Test
  @DisplayName("Should detect bare, named and boxed prompts")
  void isPrompt_PromptLines_Detected() {
    assertThat(PromptDetector.isPrompt(">")).isTrue();
    assertThat(PromptDetector.isPrompt("> ")).isTrue();
    assertThat(PromptDetector.isPrompt("codex>")).isTrue();
    assertThat(PromptDetector.isPrompt("  ❯  ")).isTrue();
    assertThat(PromptDetector.isPrompt("│ > Try \"fix lint errors\" │")).isTrue();
    assertThat(PromptDetector.isPrompt("┃❯ ┃")).isTrue();
  }

  @Test
  @DisplayName("Should ignore output lines that merely contain a marker")
  void isPrompt_OtherLines_Ignored() {
    assertThat(PromptDetector.isPrompt(null)).isFalse();
    assertThat(PromptDetector.isPrompt("   ")).isFalse();
    assertThat(PromptDetector.isPrompt("│  │")).isFalse();
    assertThat(PromptDetector.isPrompt("a > b but not at the end")).isFalse();
    assertThat(PromptDetector.isPrompt(">>>quoted")).isFalse();
    assertThat(PromptDetector.isPrompt("Thinking...")).isFalse();
  }
}
