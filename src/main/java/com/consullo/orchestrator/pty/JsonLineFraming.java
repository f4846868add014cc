package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.stream.Message;
import com.consullo.orchestrator.stream.StreamDecoder;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framing for CLIs that print JSON events on a terminal: bytes are decoded as
 * UTF-8, escape sequences stripped, text split into lines and each line fed to
 * a {@link StreamDecoder}.
 *
 * <p>
 * An unterminated line longer than the decoder's buffer cap is dropped up to
 * its newline and reported once as the decoder's overflow error.
 * </p>
 */
final class JsonLineFraming implements OutputFraming {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonLineFraming.class);

  private final StreamDecoder decoder;
  private final AnsiStripper stripper = new AnsiStripper();
  private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE);
  private final StringBuilder partialLine = new StringBuilder();

  private ByteBuffer carry = ByteBuffer.allocate(0);
  private boolean discardingLine;

  JsonLineFraming(final StreamDecoder decoder) {
    this.decoder = decoder;
  }

  @Override
  public List<Message> accept(final byte[] data, final int length) {
    final String text = stripper.strip(decode(data, length));
    final List<Message> out = new ArrayList<>();
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '\n') {
        if (discardingLine) {
          discardingLine = false;
        } else {
          out.addAll(decoder.feed(partialLine.toString()));
        }
        partialLine.setLength(0);
      } else if (c != '\r' && !discardingLine) {
        if (partialLine.length() >= decoder.maxBufferChars()) {
          LOGGER.warn("Terminal line exceeded {} chars without a newline; dropping it", decoder.maxBufferChars());
          partialLine.setLength(0);
          discardingLine = true;
          out.add(decoder.overflowError());
        } else {
          partialLine.append(c);
        }
      }
    }
    return out;
  }

  @Override
  public List<Message> onQuiet() {
    return List.of();
  }

  /**
   * Checks the unterminated line: a waiting CLI leaves its prompt without a
   * newline.
   */
  @Override
  public boolean promptVisible() {
    return PromptDetector.isPrompt(partialLine.toString());
  }

  @Override
  public void beginTurn() {
    partialLine.setLength(0);
    discardingLine = false;
    decoder.beginTurn();
  }

  @Override
  public String plainText() {
    return decoder.plainText();
  }

  @Override
  public String detailedText() {
    return decoder.detailedText();
  }

  @Override
  public String sessionId() {
    return decoder.sessionId();
  }

  private String decode(final byte[] data, final int length) {
    final ByteBuffer in = ByteBuffer.allocate(carry.remaining() + length);
    in.put(carry).put(data, 0, length).flip();
    final CharBuffer out = CharBuffer.allocate(in.remaining());
    utf8.decode(in, out, false);
    out.flip();
    carry = ByteBuffer.allocate(in.remaining()).put(in).flip();
    return out.toString();
  }
}
