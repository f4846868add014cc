package com.consullo.orchestrator.core;

import java.time.Instant;

/**
 * Immutable snapshot of the terminal modes the transcript capture depends on.
 *
 * <p>
 * Full-screen agent CLIs switch to the alternate screen and repaint it
 * constantly; capture needs to know when that is the case. The window title is
 * kept because several CLIs report their busy/idle status there.
 * </p>
 */
public final class TerminalSnapshot {

  private final Instant timestamp;
  private final int cols;
  private final int rows;
  private final boolean alternateScreen;
  private final String windowTitle;

  private TerminalSnapshot(Builder b) {
    this.timestamp = b.timestamp;
    this.cols = b.cols;
    this.rows = b.rows;
    this.alternateScreen = b.alternateScreen;
    this.windowTitle = b.windowTitle;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public int getCols() {
    return cols;
  }

  public int getRows() {
    return rows;
  }

  public boolean isAlternateScreen() {
    return alternateScreen;
  }

  public String getWindowTitle() {
    return windowTitle;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private Instant timestamp;
    private int cols;
    private int rows;
    private boolean alternateScreen;
    private String windowTitle = "";

    private Builder() {
    }

    public Builder timestamp(Instant ts) {
      this.timestamp = ts;
      return this;
    }

    public Builder cols(int cols) {
      this.cols = cols;
      return this;
    }

    public Builder rows(int rows) {
      this.rows = rows;
      return this;
    }

    public Builder alternateScreen(boolean alternateScreen) {
      this.alternateScreen = alternateScreen;
      return this;
    }

    public Builder windowTitle(String windowTitle) {
      this.windowTitle = windowTitle != null ? windowTitle : "";
      return this;
    }

    public TerminalSnapshot build() {
      if (timestamp == null) {
        timestamp = Instant.now();
      }
      if (cols <= 0 || rows <= 0) {
        throw new IllegalArgumentException("cols/rows must be positive.");
      }
      return new TerminalSnapshot(this);
    }
  }
}
