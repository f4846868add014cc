package com.consullo.orchestrator.core.jediterm;

import com.techsenger.jeditermfx.core.Color;
import com.techsenger.jeditermfx.core.CursorShape;
import com.techsenger.jeditermfx.core.RequestOrigin;
import com.techsenger.jeditermfx.core.TerminalDisplay;
import com.techsenger.jeditermfx.core.emulator.mouse.MouseFormat;
import com.techsenger.jeditermfx.core.emulator.mouse.MouseMode;
import com.techsenger.jeditermfx.core.model.TerminalSelection;
import com.techsenger.jeditermfx.core.util.TermSize;

/**
 * Display without a GUI that records the modes transcript capture needs.
 *
 * <p>
 * The emulator reports alternate-screen switches and title changes here;
 * rendering calls are ignored.
 * </p>
 */
public final class HeadlessTerminalDisplay implements TerminalDisplay {

  private volatile boolean alternateScreen;
  private volatile String windowTitle = "";

  public boolean isAlternateScreen() {
    return alternateScreen;
  }

  @Override
  public void setCursor(int x, int y) {
    // not rendered
  }

  @Override
  public void setCursorShape(CursorShape cursorShape) {
    // not rendered
  }

  @Override
  public void beep() {
    // not rendered
  }

  @Override
  public void onResize(TermSize termSize, RequestOrigin origin) {
    // size is owned by JediTermCore
  }

  @Override
  public void scrollArea(int scrollRegionTop, int scrollRegionSize, int dy) {
    // not rendered
  }

  @Override
  public void setCursorVisible(boolean visible) {
    // not rendered
  }

  @Override
  public void useAlternateScreenBuffer(boolean enabled) {
    this.alternateScreen = enabled;
  }

  @Override
  public String getWindowTitle() {
    return windowTitle;
  }

  @Override
  public void setWindowTitle(String title) {
    this.windowTitle = title != null ? title : "";
  }

  @Override
  public TerminalSelection getSelection() {
    return null;
  }

  @Override
  public void terminalMouseModeSet(MouseMode mode) {
    // not rendered
  }

  @Override
  public void setMouseFormat(MouseFormat format) {
    // not rendered
  }

  @Override
  public boolean ambiguousCharsAreDoubleWidth() {
    return false;
  }

  @Override
  public void setBracketedPasteMode(boolean enabled) {
    // input is written raw
  }

  @Override
  public Color getWindowForeground() {
    return null;
  }

  @Override
  public Color getWindowBackground() {
    return null;
  }
}
