package com.consullo.orchestrator.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Scriptable {@link Process} for executor tests: stdout and stderr are fed by
 * the test, stdin lines are recorded and optionally answered.
 *
 * @since 1.0
 */
public final class FakeProcess extends Process {

  private final QueueInputStream stdout = new QueueInputStream();
  private final QueueInputStream stderr = new QueueInputStream();
  private final LineOutputStream stdin;
  private final CountDownLatch exited = new CountDownLatch(1);
  private volatile int exitCode;
  private volatile boolean destroyed;

  public FakeProcess() {
    this(line -> {
    });
  }

  /**
   * @param onStdinLine called on the writing thread for every line written to
   * stdin
   */
  public FakeProcess(final Consumer<String> onStdinLine) {
    this.stdin = new LineOutputStream(onStdinLine);
  }

  /**
   * A process that prints {@code lines} and exits with {@code exitCode}.
   */
  public static FakeProcess emitting(final int exitCode, final String... lines) {
    final FakeProcess process = new FakeProcess();
    for (String line : lines) {
      process.emit(line);
    }
    process.exit(exitCode);
    return process;
  }

  public void emit(final String line) {
    stdout.push((line + "\n").getBytes(StandardCharsets.UTF_8));
  }

  public void emitError(final String text) {
    stderr.push(text.getBytes(StandardCharsets.UTF_8));
  }

  public void exit(final int code) {
    if (exited.getCount() == 0) {
      return;
    }
    exitCode = code;
    stdout.end();
    stderr.end();
    exited.countDown();
  }

  public List<String> stdinLines() {
    return stdin.lines;
  }

  public boolean wasDestroyed() {
    return destroyed;
  }

  @Override
  public OutputStream getOutputStream() {
    return stdin;
  }

  @Override
  public InputStream getInputStream() {
    return stdout;
  }

  @Override
  public InputStream getErrorStream() {
    return stderr;
  }

  @Override
  public int waitFor() throws InterruptedException {
    exited.await();
    return exitCode;
  }

  @Override
  public boolean waitFor(final long timeout, final TimeUnit unit) throws InterruptedException {
    return exited.await(timeout, unit);
  }

  @Override
  public int exitValue() {
    if (exited.getCount() != 0) {
      throw new IllegalThreadStateException("process has not exited");
    }
    return exitCode;
  }

  @Override
  public boolean isAlive() {
    return exited.getCount() != 0;
  }

  @Override
  public void destroy() {
    destroyed = true;
    exit(143);
  }

  @Override
  public Process destroyForcibly() {
    destroyed = true;
    exit(137);
    return this;
  }

  /**
   * Blocking stream over queued chunks; an empty chunk marks the end.
   */
  private static final class QueueInputStream extends InputStream {

    private static final byte[] END = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private byte[] current;
    private int position;
    private boolean ended;

    void push(final byte[] data) {
      chunks.add(data);
    }

    void end() {
      chunks.add(END);
    }

    @Override
    public int read() throws IOException {
      final byte[] one = new byte[1];
      final int n = read(one, 0, 1);
      return n < 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public synchronized int read(final byte[] b, final int off, final int len) throws IOException {
      if (len == 0) {
        return 0;
      }
      while (!ended && (current == null || position >= current.length)) {
        try {
          current = chunks.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IOException("interrupted", e);
        }
        position = 0;
        if (current == END) {
          ended = true;
        }
      }
      if (ended) {
        return -1;
      }
      final int n = Math.min(len, current.length - position);
      System.arraycopy(current, position, b, off, n);
      position += n;
      return n;
    }
  }

  /**
   * Splits written bytes into lines.
   */
  private static final class LineOutputStream extends OutputStream {

    private final Consumer<String> onLine;
    private final List<String> lines = new CopyOnWriteArrayList<>();
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    LineOutputStream(final Consumer<String> onLine) {
      this.onLine = onLine;
    }

    @Override
    public synchronized void write(final int b) {
      if (b == '\n') {
        final String line = new String(pending.toByteArray(), StandardCharsets.UTF_8);
        pending.reset();
        lines.add(line);
        onLine.accept(line);
      } else {
        pending.write(b);
      }
    }
  }
}
