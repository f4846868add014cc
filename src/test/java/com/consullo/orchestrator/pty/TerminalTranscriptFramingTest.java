package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.capture.MutableClock;
import com.consullo.orchestrator.stream.Message;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TerminalTranscriptFraming} on a real emulated screen.
 *
 * @since 1.0
 */
public class TerminalTranscriptFramingTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
  private final TerminalTranscriptFraming framing = TerminalTranscriptFraming.create(40, 6, clock);

  @Test
  @DisplayName("Should turn a settled answer row into an assistant message")
  void onQuiet_StableRow_EmitsAssistant() throws Exception {
    feed("Answer line one\r\n\u001b[6;1H> ");

    clock.advance(Duration.ofMillis(600));
    final List<Message> messages = framing.onQuiet();

    assertThat(messages).hasSize(1);
    assertThat(((Message.Assistant) messages.get(0)).text()).isEqualTo("Answer line one");
    assertThat(framing.plainText()).isEqualTo("Answer line one");
    assertThat(framing.sessionId()).isNull();
  }

  @Test
  @DisplayName("Should find the prompt above status hints on the bottom rows")
  void promptVisible_PromptAboveHints_Detected() throws Exception {
    feed("\u001b[5;1H│ > \u001b[6;1H  ? for shortcuts");

    assertThat(framing.promptVisible()).isTrue();
  }

  @Test
  @DisplayName("Should not see a prompt while the CLI is still printing")
  void promptVisible_ContentBelowPrompt_NotDetected() throws Exception {
    feed("> earlier\r\nWorking on it");

    assertThat(framing.promptVisible()).isFalse();
  }

  @Test
  @DisplayName("Should start each turn with an empty transcript")
  void beginTurn_ClearsTranscript() throws Exception {
    feed("first answer\r\n");
    clock.advance(Duration.ofMillis(600));
    framing.onQuiet();

    framing.beginTurn();

    assertThat(framing.plainText()).isEmpty();
    assertThat(framing.onQuiet()).isEmpty();
  }

  private void feed(final String text) throws Exception {
    final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    framing.accept(bytes, bytes.length);
  }
}
