package com.consullo.orchestrator.capture;

import com.consullo.orchestrator.core.ScrollbackView;
import com.consullo.orchestrator.core.TerminalCore;
import com.consullo.orchestrator.core.TerminalSnapshot;
import com.consullo.orchestrator.core.events.DamageEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the capture engine using deterministic in-memory scrollback and snapshots.
 *
 * @since 1.0
 */
public class CaptureEngineTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
  private final FakeScrollback scrollback = new FakeScrollback();
  private final TerminalCore core = core(scrollback);

  @Test
  @DisplayName("Should emit newly committed scrollback lines once each")
  void onDamage_ScrollbackDelta_EmitsLines() throws Exception {
    final CaptureEngine engine = new CaptureEngine(new CaptureEngineConfig(2, 350L, true, 100),
            new DefaultChurnFilterPolicy(), clock);
    scrollback.history.add("a");
    scrollback.history.add("b");

    final List<TranscriptEvent> first = engine.onDamage(core, snapshot(false), redraw());
    scrollback.history.add("c");
    final List<TranscriptEvent> second = engine.onDamage(core, snapshot(false), redraw());

    assertThat(first).extracting(TranscriptEvent::text).containsExactly("a", "b");
    assertThat(first.get(0).source()).isEqualTo(TranscriptEvent.Source.SCROLLBACK);
    assertThat(second).extracting(TranscriptEvent::text).containsExactly("c");
  }

  @Test
  @DisplayName("Should emit a screen row only after it stayed unchanged for the stability window")
  void onDamage_ScreenRow_WaitsForStability() throws Exception {
    final CaptureEngine engine = new CaptureEngine(new CaptureEngineConfig(0, 500L, true, 100),
            new DefaultChurnFilterPolicy(), clock);
    scrollback.screen.add("Reading files");

    assertThat(engine.onDamage(core, snapshot(false), redraw())).isEmpty();
    clock.advance(Duration.ofMillis(200));
    scrollback.screen.set(0, "Reading files done");
    assertThat(engine.onDamage(core, snapshot(false), redraw())).isEmpty();
    clock.advance(Duration.ofMillis(499));
    assertThat(engine.onDamage(core, snapshot(false), idle())).isEmpty();
    clock.advance(Duration.ofMillis(1));
    final List<TranscriptEvent> stable = engine.onDamage(core, snapshot(false), idle());
    clock.advance(Duration.ofSeconds(5));

    assertThat(stable).extracting(TranscriptEvent::text).containsExactly("Reading files done");
    assertThat(stable.get(0).source()).isEqualTo(TranscriptEvent.Source.SCREEN_STABLE);
    assertThat(engine.onDamage(core, snapshot(false), idle())).isEmpty();
  }

  @Test
  @DisplayName("Should never capture the volatile bottom rows")
  void onDamage_VolatileRows_Skipped() throws Exception {
    final CaptureEngine engine = new CaptureEngine(new CaptureEngineConfig(2, 0L, true, 100),
            new DefaultChurnFilterPolicy(), clock);
    scrollback.screen.add("answer line");
    scrollback.screen.add("> type here");
    scrollback.screen.add("model: sonnet");

    engine.onDamage(core, snapshot(false), redraw());
    final List<TranscriptEvent> events = engine.onDamage(core, snapshot(false), idle());

    assertThat(events).extracting(TranscriptEvent::text).containsExactly("answer line");
  }

  @Test
  @DisplayName("Should suppress screen rows on the alternate screen when configured")
  void onDamage_AlternateScreen_Suppressed() throws Exception {
    final CaptureEngine engine = new CaptureEngine(new CaptureEngineConfig(0, 0L, true, 100),
            new DefaultChurnFilterPolicy(), clock);
    scrollback.screen.add("full screen editor");

    engine.onDamage(core, snapshot(true), redraw());

    assertThat(engine.onDamage(core, snapshot(true), idle())).isEmpty();
  }

  @Test
  @DisplayName("Should drop churn and repeated lines until a new turn begins")
  void onDamage_ChurnAndDuplicates_DroppedUntilBeginTurn() throws Exception {
    final CaptureEngine engine = new CaptureEngine(new CaptureEngineConfig(0, 0L, true, 100),
            new DefaultChurnFilterPolicy(), clock);
    scrollback.history.add("done");
    scrollback.history.add("✻ Pondering… (3s)");
    scrollback.history.add("done");

    final List<TranscriptEvent> first = engine.onDamage(core, snapshot(false), redraw());
    engine.beginTurn();
    scrollback.history.add("done");
    final List<TranscriptEvent> next = engine.onDamage(core, snapshot(false), redraw());

    assertThat(first).extracting(TranscriptEvent::text).containsExactly("done");
    assertThat(next).extracting(TranscriptEvent::text).containsExactly("done");
  }

  @Test
  @DisplayName("Should treat rows already on screen as part of the previous turn")
  void beginTurn_RowsOnScreen_NotReEmitted() throws Exception {
    final CaptureEngine engine = new CaptureEngine(new CaptureEngineConfig(0, 0L, true, 100),
            new DefaultChurnFilterPolicy(), clock);
    scrollback.screen.add("old answer");
    engine.onDamage(core, snapshot(false), redraw());

    engine.beginTurn();

    assertThat(engine.onDamage(core, snapshot(false), idle())).isEmpty();
  }

  private TerminalSnapshot snapshot(final boolean alternate) {
    return TerminalSnapshot.builder()
            .timestamp(clock.instant())
            .cols(80)
            .rows(24)
            .alternateScreen(alternate)
            .build();
  }

  private DamageEvent redraw() {
    return DamageEvent.fullRedraw(clock.instant());
  }

  private DamageEvent idle() {
    return DamageEvent.idle(clock.instant());
  }

  private static TerminalCore core(final ScrollbackView view) {
    final TerminalCore core = mock(TerminalCore.class);
    try {
      when(core.scrollback()).thenReturn(view);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
    return core;
  }

  /**
   * Scrollback backed by two mutable lists.
   */
  private static final class FakeScrollback implements ScrollbackView {

    private final List<String> history = new ArrayList<>();
    private final List<String> screen = new ArrayList<>();

    @Override
    public int historyLineCount() {
      return history.size();
    }

    @Override
    public int screenRowCount() {
      return screen.size();
    }

    @Override
    public List<String> readHistoryLines(final int startInclusive, final int endExclusive) {
      return new ArrayList<>(history.subList(startInclusive, Math.min(endExclusive, history.size())));
    }

    @Override
    public List<String> readScreenLines(final int startInclusive, final int endExclusive) {
      return new ArrayList<>(screen.subList(startInclusive, Math.min(endExclusive, screen.size())));
    }
  }
}
