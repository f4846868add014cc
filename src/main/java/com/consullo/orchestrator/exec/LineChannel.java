package com.consullo.orchestrator.exec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads lines from a process stream on a daemon thread so that callers can
 * wait for the next line with a timeout.
 *
 * @since 1.0
 */
public final class LineChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger(LineChannel.class);

  /**
   * One polled item: a line, or the end of the stream.
   *
   * @param text line text (null at end of stream)
   * @param endOfStream true when the stream is exhausted
   */
  public record Line(String text, boolean endOfStream) {
  }

  private static final Line END = new Line(null, true);

  private final BlockingQueue<Line> queue = new LinkedBlockingQueue<>();
  private volatile boolean ended;

  private LineChannel() {
  }

  /**
   * Starts pumping {@code in} on a daemon thread named {@code threadName}.
   */
  public static LineChannel start(final InputStream in, final String threadName) {
    final LineChannel channel = new LineChannel();
    final Thread reader = new Thread(() -> channel.pump(in), threadName);
    reader.setDaemon(true);
    reader.start();
    return channel;
  }

  /**
   * Waits up to {@code timeout} for the next line.
   *
   * @return the next line, the end-of-stream marker, or null on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public Line poll(final Duration timeout) throws InterruptedException {
    if (ended && queue.isEmpty()) {
      return END;
    }
    final Line line = queue.poll(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    if (line != null && line.endOfStream()) {
      ended = true;
    }
    return line;
  }

  public boolean isEnded() {
    return ended && queue.isEmpty();
  }

  private void pump(final InputStream in) {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        queue.add(new Line(line, false));
      }
    } catch (IOException e) {
      LOGGER.debug("Output stream closed: {}", e.getMessage());
    } finally {
      queue.add(END);
    }
  }
}
