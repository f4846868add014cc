package com.consullo.orchestrator.core.jediterm;

import com.consullo.orchestrator.core.ScrollbackView;
import com.consullo.orchestrator.core.TerminalCore;
import com.consullo.orchestrator.core.TerminalSnapshot;
import com.consullo.orchestrator.core.events.DamageEvent;
import com.consullo.orchestrator.core.events.DamageListener;
import com.techsenger.jeditermfx.core.RequestOrigin;
import com.techsenger.jeditermfx.core.emulator.JediEmulator;
import com.techsenger.jeditermfx.core.model.JediTerminal;
import com.techsenger.jeditermfx.core.model.StyleState;
import com.techsenger.jeditermfx.core.model.TerminalLine;
import com.techsenger.jeditermfx.core.model.TerminalTextBuffer;
import com.techsenger.jeditermfx.core.util.TermSize;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TerminalCore} implementation backed by JediTerm.
 *
 * <p>
 * This integrates:
 * <ul>
 * <li>ANSI/VT parsing: {@link JediEmulator}</li>
 * <li>Terminal state and cursor: {@link JediTerminal}</li>
 * <li>Scrollback: {@link TerminalTextBuffer} (negative indices are
 * history)</li>
 * <li>Mode tracking: {@link HeadlessTerminalDisplay}</li>
 * </ul>
 * </p>
 */
public final class JediTermCore implements TerminalCore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JediTermCore.class);

  /** Scrollback retained by default. */
  public static final int DEFAULT_HISTORY_LINES = 5_000;

  private final Object lock = new Object();

  private final Utf8TerminalDataStream dataStream;
  private final HeadlessTerminalDisplay display;
  private final TerminalTextBuffer textBuffer;
  private final JediTerminal terminal;
  private final JediEmulator emulator;
  private final Clock clock;

  private final List<DamageListener> listeners = new ArrayList<>();

  private int cols;
  private int rows;

  public JediTermCore(int cols, int rows) {
    this(cols, rows, DEFAULT_HISTORY_LINES, Clock.systemUTC());
  }

  /**
   * Creates a terminal core with given screen size and scrollback capacity.
   *
   * @param cols screen columns
   * @param rows screen rows
   * @param maxHistoryLines max scrollback lines to retain
   * @param clock time source for snapshots and damage events
   */
  public JediTermCore(int cols, int rows, int maxHistoryLines, Clock clock) {
    if (cols <= 0 || rows <= 0) {
      throw new IllegalArgumentException("cols/rows must be positive.");
    }
    if (maxHistoryLines <= 0) {
      throw new IllegalArgumentException("maxHistoryLines must be positive.");
    }
    if (clock == null) {
      throw new IllegalArgumentException("clock must not be null.");
    }
    this.cols = cols;
    this.rows = rows;
    this.clock = clock;

    this.dataStream = new Utf8TerminalDataStream();
    this.display = new HeadlessTerminalDisplay();
    final StyleState styleState = new StyleState();
    this.textBuffer = new TerminalTextBuffer(cols, rows, styleState, maxHistoryLines, null);
    this.terminal = new JediTerminal(display, textBuffer, styleState);
    this.emulator = new JediEmulator(dataStream, terminal);
  }

  @Override
  public void feed(byte[] data, int off, int len) {
    if (data == null) {
      throw new IllegalArgumentException("data must not be null.");
    }
    if (len <= 0) {
      return;
    }

    int processed = 0;
    synchronized (lock) {
      dataStream.appendBytes(data, off, len);
      // The emulator latches EOF when the stream runs dry.
      emulator.resetEof();
      while (emulator.hasNext()) {
        try {
          emulator.next();
          processed++;
        } catch (IOException e) {
          LOGGER.debug("feed: IOException after {} iterations", processed);
          break;
        } catch (RuntimeException e) {
          LOGGER.warn("feed: emulator failed after {} iterations: {}", processed, e.getMessage());
          break;
        }
      }
    }

    LOGGER.debug("feed: {} bytes, {} emulator steps", len, processed);
    if (processed > 0) {
      fireDamage(DamageEvent.fullRedraw(clock.instant()));
    }
  }

  @Override
  public TerminalSnapshot snapshot() {
    synchronized (lock) {
      return TerminalSnapshot.builder()
              .timestamp(clock.instant())
              .cols(cols)
              .rows(rows)
              .alternateScreen(display.isAlternateScreen())
              .windowTitle(display.getWindowTitle())
              .build();
    }
  }

  @Override
  public ScrollbackView scrollback() {
    return new JediTermScrollbackView(textBuffer, lock);
  }

  @Override
  public void addDamageListener(DamageListener l) {
    if (l == null) {
      throw new IllegalArgumentException("listener must not be null.");
    }
    synchronized (lock) {
      listeners.add(l);
    }
  }

  @Override
  public void resize(int cols, int rows) {
    if (cols <= 0 || rows <= 0) {
      throw new IllegalArgumentException("cols/rows must be positive.");
    }
    synchronized (lock) {
      this.cols = cols;
      this.rows = rows;
      // also resizes the text buffer
      terminal.resize(new TermSize(cols, rows), RequestOrigin.Remote);
    }
    fireDamage(DamageEvent.fullRedraw(clock.instant()));
  }

  private void fireDamage(DamageEvent ev) {
    final List<DamageListener> copy;
    synchronized (lock) {
      copy = new ArrayList<>(listeners);
    }
    final TerminalSnapshot snap = snapshot();
    for (DamageListener dl : copy) {
      try {
        dl.onDamage(snap, ev);
      } catch (Exception e) {
        LOGGER.warn("Damage listener {} failed: {}", dl, e.getMessage(), e);
      }
    }
  }

  /**
   * Scrollback view over {@link TerminalTextBuffer}: history lines are
   * committed, screen lines are the current display.
   */
  private static final class JediTermScrollbackView implements ScrollbackView {

    private final TerminalTextBuffer buf;
    private final Object lock;

    private JediTermScrollbackView(TerminalTextBuffer buf, Object lock) {
      this.buf = buf;
      this.lock = lock;
    }

    @Override
    public int historyLineCount() {
      synchronized (lock) {
        return buf.getHistoryLinesCount();
      }
    }

    @Override
    public int screenRowCount() {
      synchronized (lock) {
        return buf.getHeight();
      }
    }

    @Override
    public List<String> readHistoryLines(int startInclusive, int endExclusive) {
      synchronized (lock) {
        final int history = buf.getHistoryLinesCount();
        final List<String> result = new ArrayList<>();
        for (int index = Math.max(0, startInclusive); index < endExclusive && index < history; index++) {
          // 0..history-1 maps to buffer indices -history..-1
          result.add(plainText(buf.getLine(index - history)));
        }
        return result;
      }
    }

    @Override
    public List<String> readScreenLines(int startInclusive, int endExclusive) {
      synchronized (lock) {
        final int height = buf.getHeight();
        final List<String> result = new ArrayList<>();
        for (int index = Math.max(0, startInclusive); index < endExclusive && index < height; index++) {
          result.add(plainText(buf.getLine(index)));
        }
        return result;
      }
    }

    private static String plainText(TerminalLine line) {
      if (line == null) {
        return "";
      }
      final List<TerminalLine.TextEntry> entries = line.getEntries();
      if (entries == null) {
        return "";
      }
      final StringBuilder sb = new StringBuilder();
      for (TerminalLine.TextEntry e : entries) {
        if (e != null && e.getText() != null) {
          sb.append(e.getText());
        }
      }
      // Empty cells are NUL
      int n = sb.length();
      while (n > 0) {
        final char c = sb.charAt(n - 1);
        if (c == ' ' || c == '\0' || c == '\t') {
          n--;
        } else {
          break;
        }
      }
      sb.setLength(n);
      return sb.toString();
    }
  }
}
