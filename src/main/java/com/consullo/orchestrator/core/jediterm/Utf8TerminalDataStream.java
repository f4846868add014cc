package com.consullo.orchestrator.core.jediterm;

import com.techsenger.jeditermfx.core.TerminalDataStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A {@link TerminalDataStream} fed with raw PTY bytes and decoded as UTF-8.
 *
 * <p>
 * Agent CLIs draw prompts and status lines with non-ASCII glyphs, so bytes are
 * decoded before the emulator sees them. A multi-byte sequence split across two
 * reads is carried over to the next {@link #appendBytes} call; malformed input
 * becomes U+FFFD.
 * </p>
 *
 * <p>
 * Reads never block: when the queue is empty {@link #getChar()} throws
 * {@link TerminalDataStream.EOF}, which ends the emulator's {@code hasNext()}
 * loop until more bytes arrive.
 * </p>
 */
public final class Utf8TerminalDataStream implements TerminalDataStream {

  private final Object lock = new Object();
  private final Deque<Character> queue = new ArrayDeque<>();
  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE);

  private ByteBuffer carry = ByteBuffer.allocate(0);

  /**
   * Appends bytes to the stream.
   *
   * @param data byte array
   * @param off offset
   * @param len length
   */
  public void appendBytes(byte[] data, int off, int len) {
    if (data == null) {
      throw new IllegalArgumentException("data must not be null.");
    }
    if (off < 0 || len < 0 || off + len > data.length) {
      throw new IllegalArgumentException("Invalid off/len.");
    }
    synchronized (lock) {
      final ByteBuffer in = ByteBuffer.allocate(carry.remaining() + len);
      in.put(carry).put(data, off, len).flip();
      // UTF-8 never yields more chars than bytes
      final CharBuffer out = CharBuffer.allocate(in.remaining());
      decoder.decode(in, out, false);
      out.flip();
      while (out.hasRemaining()) {
        queue.addLast(out.get());
      }
      carry = ByteBuffer.allocate(in.remaining()).put(in).flip();
    }
  }

  /**
   * Number of undecoded bytes waiting for the rest of their sequence.
   */
  public int pendingByteCount() {
    synchronized (lock) {
      return carry.remaining();
    }
  }

  @Override
  public char getChar() throws IOException {
    synchronized (lock) {
      if (queue.isEmpty()) {
        throw new TerminalDataStream.EOF();
      }
      return queue.removeFirst();
    }
  }

  @Override
  public void pushChar(char c) throws IOException {
    synchronized (lock) {
      queue.addFirst(c);
    }
  }

  @Override
  public String readNonControlCharacters(int maxChars) throws IOException {
    if (maxChars <= 0) {
      return "";
    }
    final StringBuilder sb = new StringBuilder();
    synchronized (lock) {
      while (sb.length() < maxChars && !queue.isEmpty()) {
        final char c = queue.peekFirst();
        if (isControl(c)) {
          break;
        }
        queue.removeFirst();
        sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public void pushBackBuffer(char[] chars, int length) throws IOException {
    synchronized (lock) {
      for (int i = length - 1; i >= 0; i--) {
        queue.addFirst(chars[i]);
      }
    }
  }

  @Override
  public boolean isEmpty() {
    synchronized (lock) {
      return queue.isEmpty();
    }
  }

  private static boolean isControl(char c) {
    // C0 controls plus DEL
    return c <= 0x1F || c == 0x7F;
  }
}
