package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.capture.CaptureEngine;
import com.consullo.orchestrator.capture.CaptureEngineConfig;
import com.consullo.orchestrator.capture.ChurnFilterPolicy;
import com.consullo.orchestrator.capture.DefaultChurnFilterPolicy;
import com.consullo.orchestrator.capture.TranscriptEvent;
import com.consullo.orchestrator.core.ScrollbackView;
import com.consullo.orchestrator.core.TerminalCore;
import com.consullo.orchestrator.core.events.DamageEvent;
import com.consullo.orchestrator.core.jediterm.JediTermCore;
import com.consullo.orchestrator.stream.Message;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Framing for full-screen CLIs: output is run through a terminal emulator and
 * the capture engine's transcript lines become {@link Message.Assistant}
 * messages.
 *
 * <p>
 * The prompt is looked for on the lowest screen line that carries content,
 * skipping rows the churn policy treats as status chrome (hints, borders).
 * </p>
 */
final class TerminalTranscriptFraming implements OutputFraming {

  private final TerminalCore core;
  private final CaptureEngine engine;
  private final ChurnFilterPolicy churnPolicy;
  private final Clock clock;
  private final List<TranscriptEvent> captured = new ArrayList<>();
  private final StringBuilder transcript = new StringBuilder();

  TerminalTranscriptFraming(
          final TerminalCore core,
          final CaptureEngine engine,
          final ChurnFilterPolicy churnPolicy,
          final Clock clock) throws Exception {
    this.core = core;
    this.engine = engine;
    this.churnPolicy = churnPolicy;
    this.clock = clock;
    core.addDamageListener((snapshot, event) -> captured.addAll(engine.onDamage(core, snapshot, event)));
  }

  static TerminalTranscriptFraming create(final int columns, final int rows, final Clock clock) {
    final ChurnFilterPolicy policy = new DefaultChurnFilterPolicy();
    try {
      return new TerminalTranscriptFraming(
              new JediTermCore(columns, rows, JediTermCore.DEFAULT_HISTORY_LINES, clock),
              new CaptureEngine(CaptureEngineConfig.agentDefaults(), policy, clock),
              policy,
              clock);
    } catch (Exception e) {
      throw new IllegalStateException("Cannot set up terminal emulation: " + e.getMessage(), e);
    }
  }

  @Override
  public List<Message> accept(final byte[] data, final int length) throws Exception {
    core.feed(data, 0, length);
    return drain();
  }

  @Override
  public List<Message> onQuiet() throws Exception {
    captured.addAll(engine.onDamage(core, core.snapshot(), DamageEvent.idle(clock.instant())));
    return drain();
  }

  @Override
  public boolean promptVisible() throws Exception {
    final ScrollbackView view = core.scrollback();
    final List<String> lines = view.readScreenLines(0, view.screenRowCount());
    for (int i = lines.size() - 1; i >= 0; i--) {
      final String line = lines.get(i).strip();
      if (line.isEmpty()) {
        continue;
      }
      if (PromptDetector.isPrompt(line)) {
        return true;
      }
      if (!churnPolicy.shouldSuppressRow(line)) {
        return false;
      }
    }
    return false;
  }

  @Override
  public void beginTurn() {
    transcript.setLength(0);
    captured.clear();
    engine.beginTurn();
  }

  @Override
  public String plainText() {
    return transcript.toString();
  }

  @Override
  public String detailedText() {
    return transcript.toString();
  }

  @Override
  public String sessionId() {
    return null;
  }

  private List<Message> drain() {
    if (captured.isEmpty()) {
      return List.of();
    }
    final List<Message> out = new ArrayList<>(captured.size());
    for (TranscriptEvent event : captured) {
      if (transcript.length() > 0) {
        transcript.append('\n');
      }
      transcript.append(event.text());
      out.add(new Message.Assistant(event.text()));
    }
    captured.clear();
    return out;
  }
}
