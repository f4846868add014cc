package com.consullo.orchestrator.core.jediterm;

import com.consullo.orchestrator.core.ScrollbackView;
import com.consullo.orchestrator.core.events.DamageEvent;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JediTermCore} with real escape sequences.
 *
 * @since 1.0
 */
public class JediTermCoreTest {

  private final JediTermCore core = new JediTermCore(40, 3, 100, Clock.systemUTC());

  @Test
  @DisplayName("Should render text onto screen rows without colour codes")
  void feed_ColouredText_RendersPlainRows() {
    feed("\u001b[1;34mhello\u001b[0m\r\nworld");

    final ScrollbackView view = core.scrollback();
    assertThat(view.readScreenLines(0, 2)).containsExactly("hello", "world");
    assertThat(view.historyLineCount()).isZero();
  }

  @Test
  @DisplayName("Should move lines that scroll off the screen into history")
  void feed_MoreLinesThanRows_FillsHistory() {
    feed("one\r\ntwo\r\nthree\r\nfour\r\nfive");

    final ScrollbackView view = core.scrollback();
    assertThat(view.historyLineCount()).isEqualTo(2);
    assertThat(view.readHistoryLines(0, 2)).containsExactly("one", "two");
    assertThat(view.readScreenLines(0, 3)).containsExactly("three", "four", "five");
  }

  @Test
  @DisplayName("Should track the alternate screen and window title")
  void feed_ModeSequences_ReflectedInSnapshot() {
    feed("\u001b]0;agent: busy\u0007\u001b[?1049h");
    assertThat(core.snapshot().isAlternateScreen()).isTrue();
    assertThat(core.snapshot().getWindowTitle()).isEqualTo("agent: busy");

    feed("\u001b[?1049l");
    assertThat(core.snapshot().isAlternateScreen()).isFalse();
  }

  @Test
  @DisplayName("Should notify damage listeners after each fed batch")
  void feed_Listener_ReceivesFullRedraw() {
    final List<DamageEvent> events = new CopyOnWriteArrayList<>();
    core.addDamageListener((snapshot, event) -> events.add(event));

    feed("x");
    core.feed(new byte[0], 0, 0);

    assertThat(events).hasSize(1);
    assertThat(events.get(0).fullRedraw()).isTrue();
  }

  @Test
  @DisplayName("Should report the new size after a resize")
  void resize_UpdatesSnapshot() {
    core.resize(100, 30);

    assertThat(core.snapshot().getCols()).isEqualTo(100);
    assertThat(core.snapshot().getRows()).isEqualTo(30);
  }

  private void feed(final String text) {
    final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    core.feed(bytes, 0, bytes.length);
  }
}
