package com.consullo.orchestrator.core;

import com.consullo.orchestrator.core.events.DamageListener;

/**
 * Terminal emulation over raw PTY output: maintains the screen and scrollback
 * a full-screen agent CLI renders into.
 *
 * <p>Callers serialize {@link #feed} on a single thread.
 *
 * @since 1.0
 */
public interface TerminalCore {

  /**
   * Feeds raw bytes read from the PTY into the emulator.
   *
   * @param data raw bytes read from the PTY output stream
   * @param offset offset into the data array
   * @param length number of bytes to read from the array
   * @throws Exception if terminal parsing fails
   */
  void feed(final byte[] data, final int offset, final int length) throws Exception;

  /**
   * Returns an immutable snapshot of the current terminal modes and size.
   *
   * @return terminal snapshot
   * @throws Exception if snapshot construction fails
   */
  TerminalSnapshot snapshot() throws Exception;

  /**
   * Returns a view over the screen and scrollback buffer.
   *
   * @return scrollback view
   * @throws Exception if scrollback access fails
   */
  ScrollbackView scrollback() throws Exception;

  /**
   * Resizes the emulated screen.
   *
   * @param columns number of columns in the terminal
   * @param rows number of rows in the terminal
   * @throws Exception if resize fails
   */
  void resize(final int columns, final int rows) throws Exception;

  /**
   * Adds a listener invoked after each batch of fed bytes changed the
   * terminal.
   *
   * @param listener listener to add
   * @throws Exception if listener cannot be added
   */
  void addDamageListener(final DamageListener listener) throws Exception;
}
