package com.consullo.orchestrator.capture;

import com.consullo.orchestrator.core.ScrollbackView;
import com.consullo.orchestrator.core.TerminalCore;
import com.consullo.orchestrator.core.TerminalSnapshot;
import com.consullo.orchestrator.core.events.DamageEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts terminal state updates into churn-suppressed transcript lines.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Emit new scrollback lines immediately (committed content).</li>
 * <li>Emit screen lines only after they stayed unchanged for the stability
 * window.</li>
 * <li>Skip the volatile bottom rows (prompt box, spinner, status bar).</li>
 * <li>Suppress screen emissions in alternate screen mode if configured.</li>
 * <li>Drop lines identical to a recently emitted one; {@link #beginTurn()}
 * forgets them.</li>
 * </ul>
 * </p>
 *
 * <p>Not thread-safe; driven from the PTY session's reading thread.
 */
public final class CaptureEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptureEngine.class);

  private final CaptureEngineConfig config;
  private final ChurnFilterPolicy churnPolicy;
  private final Clock clock;

  private int lastEmittedHistoryIndex;

  // row index -> state
  private final Map<Integer, ScreenRowState> screenRowStates = new HashMap<>();

  private final Set<String> recentLines;

  private static final class ScreenRowState {
    String content;
    long firstSeenMillis;
    boolean emitted;

    ScreenRowState(String content, long firstSeenMillis) {
      this.content = content;
      this.firstSeenMillis = firstSeenMillis;
    }
  }

  public CaptureEngine(CaptureEngineConfig config, ChurnFilterPolicy churnPolicy) {
    this(config, churnPolicy, Clock.systemUTC());
  }

  public CaptureEngine(CaptureEngineConfig config, ChurnFilterPolicy churnPolicy, Clock clock) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(churnPolicy, "churnPolicy must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.config = config;
    this.churnPolicy = churnPolicy;
    this.clock = clock;
    final int capacity = config.dedupeCapacity();
    this.recentLines = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>(64, 0.75f, false) {
      private static final long serialVersionUID = 1L;

      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
        return size() > capacity;
      }
    });
  }

  /**
   * Forgets emitted lines so a new turn may repeat earlier output. History
   * already emitted is not re-read.
   */
  public void beginTurn() {
    recentLines.clear();
    for (ScreenRowState state : screenRowStates.values()) {
      // rows already on screen belong to the previous turn
      state.emitted = true;
    }
  }

  /**
   * Handles a terminal damage notification.
   *
   * @param core terminal core
   * @param snapshot snapshot taken with the event (may be null)
   * @param event damage event
   * @return transcript lines in screen order
   * @throws Exception if the core or churn policy fails
   */
  public List<TranscriptEvent> onDamage(TerminalCore core, TerminalSnapshot snapshot, DamageEvent event) throws Exception {
    Validate.notNull(core, "core must not be null");

    final List<TranscriptEvent> out = new ArrayList<>();
    final Instant now = clock.instant();
    final long nowMillis = now.toEpochMilli();

    final ScrollbackView sb = core.scrollback();
    final int historyCount = sb.historyLineCount();
    if (lastEmittedHistoryIndex > historyCount) {
      // history was trimmed or cleared
      lastEmittedHistoryIndex = historyCount;
    }
    for (String line : sb.readHistoryLines(lastEmittedHistoryIndex, historyCount)) {
      offer(line, now, TranscriptEvent.Source.SCROLLBACK, out);
    }
    lastEmittedHistoryIndex = historyCount;

    final boolean inAltScreen = snapshot != null && snapshot.isAlternateScreen();
    if (inAltScreen && config.suppressAlternateScreen()) {
      screenRowStates.clear();
      return out;
    }

    final int screenRows = sb.screenRowCount();
    final int stableRowLimit = Math.max(0, screenRows - config.volatileRowCount());
    final List<String> screenLines = sb.readScreenLines(0, stableRowLimit);

    for (int row = 0; row < screenLines.size(); row++) {
      final String content = normalizeLine(screenLines.get(row));
      final ScreenRowState state = screenRowStates.get(row);
      if (state == null) {
        screenRowStates.put(row, new ScreenRowState(content, nowMillis));
      } else if (!content.equals(state.content)) {
        state.content = content;
        state.firstSeenMillis = nowMillis;
        state.emitted = false;
      } else if (!state.emitted && nowMillis - state.firstSeenMillis >= config.stabilityWindowMillis()) {
        offer(content, now, TranscriptEvent.Source.SCREEN_STABLE, out);
        state.emitted = true;
      }
    }
    screenRowStates.keySet().removeIf(row -> row >= stableRowLimit);

    if (!out.isEmpty()) {
      LOGGER.debug("Captured {} transcript lines", out.size());
    }
    return out;
  }

  private void offer(String raw, Instant now, TranscriptEvent.Source source, List<TranscriptEvent> out)
          throws Exception {
    if (raw == null) {
      return;
    }
    final String normalized = normalizeLine(raw);
    if (normalized.isEmpty() || churnPolicy.shouldSuppressRow(normalized)) {
      return;
    }
    if (!recentLines.add(normalized)) {
      return;
    }
    out.add(TranscriptEvent.line(normalized, now, source));
  }

  private static String normalizeLine(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && isBlank(s.charAt(start))) {
      start++;
    }
    while (end > start && isBlank(s.charAt(end - 1))) {
      end--;
    }
    return start == 0 && end == s.length() ? s : s.substring(start, end);
  }

  private static boolean isBlank(char c) {
    // terminals use NUL for empty cells
    return c == ' ' || c == '\0' || c == '\t';
  }
}
