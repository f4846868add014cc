package com.consullo.orchestrator.exec;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a process stream (usually stderr) on a daemon thread, keeping at
 * most a fixed number of leading characters.
 *
 * @since 1.0
 */
public final class OutputCollector {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputCollector.class);

  static final int DEFAULT_LIMIT = 64 * 1024;

  private final StringBuilder text = new StringBuilder();
  private final int limit;
  private final Thread thread;

  private OutputCollector(final InputStream in, final int limit, final String threadName) {
    this.limit = limit;
    this.thread = new Thread(() -> drain(in), threadName);
    this.thread.setDaemon(true);
  }

  public static OutputCollector start(final InputStream in, final String threadName) {
    final OutputCollector collector = new OutputCollector(in, DEFAULT_LIMIT, threadName);
    collector.thread.start();
    return collector;
  }

  /**
   * Returns the collected text after waiting up to {@code waitMillis} for the
   * stream to end.
   */
  public String text(final long waitMillis) {
    try {
      thread.join(Math.max(1L, waitMillis));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    synchronized (text) {
      return text.toString().strip();
    }
  }

  private void drain(final InputStream in) {
    final char[] buf = new char[4096];
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      int n;
      while ((n = reader.read(buf)) >= 0) {
        synchronized (text) {
          final int room = limit - text.length();
          if (room > 0) {
            text.append(buf, 0, Math.min(room, n));
          }
        }
      }
    } catch (IOException e) {
      LOGGER.debug("Error stream closed: {}", e.getMessage());
    }
  }
}
