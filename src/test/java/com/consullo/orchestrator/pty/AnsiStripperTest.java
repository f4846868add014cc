package com.consullo.orchestrator.pty;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AnsiStripperTest {

  private final AnsiStripper stripper = new AnsiStripper();

  @Test
  @DisplayName("Should remove colour and cursor sequences but keep line structure")
  void strip_CsiSequences_Removed() {
    assertThat(stripper.strip("\u001b[1;32mok\u001b[0m\r\n\u001b[2K\u001b[1Gnext\tline"))
            .isEqualTo("ok\r\nnext\tline");
  }

  @Test
  @DisplayName("Should remove window-title sequences ended by BEL or ST")
  void strip_OscSequences_Removed() {
    assertThat(stripper.strip("\u001b]0;codex\u0007a\u001b]2;title\u001b\\b")).isEqualTo("ab");
  }

  @Test
  @DisplayName("Should remove a sequence split across two reads")
  void strip_SplitSequence_RemovedAcrossCalls() {
    assertThat(stripper.strip("left\u001b[3")).isEqualTo("left");
    assertThat(stripper.strip("8;5;208mright")).isEqualTo("right");
  }

  @Test
  @DisplayName("Should drop stray control characters and charset selections")
  void strip_ControlCharacters_Dropped() {
    assertThat(stripper.strip("a\u0008b\u001b(Bc\u007fd")).isEqualTo("abcd");
  }

  @Test
  @DisplayName("Should start clean after a reset")
  void reset_PendingSequence_Forgotten() {
    stripper.strip("\u001b[");
    stripper.reset();

    assertThat(stripper.strip("1mtext")).isEqualTo("1mtext");
  }
}
