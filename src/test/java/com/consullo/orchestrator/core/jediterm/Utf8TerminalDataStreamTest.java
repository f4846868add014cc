package com.consullo.orchestrator.core.jediterm;

import com.techsenger.jeditermfx.core.TerminalDataStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Utf8TerminalDataStreamTest {

  private final Utf8TerminalDataStream stream = new Utf8TerminalDataStream();

  @Test
  @DisplayName("Should hold back a split multi-byte character until its last byte arrives")
  void appendBytes_SplitGlyph_DecodedWhole() throws Exception {
    final byte[] glyph = "❯".getBytes(StandardCharsets.UTF_8);

    stream.appendBytes(glyph, 0, 2);
    assertThat(stream.isEmpty()).isTrue();
    assertThat(stream.pendingByteCount()).isEqualTo(2);

    stream.appendBytes(glyph, 2, 1);
    assertThat(stream.getChar()).isEqualTo('❯');
    assertThat(stream.pendingByteCount()).isZero();
  }

  @Test
  @DisplayName("Should replace malformed bytes instead of failing")
  void appendBytes_Malformed_Replaced() throws Exception {
    stream.appendBytes(new byte[] {(byte) 0xFF, 'a'}, 0, 2);

    assertThat(stream.getChar()).isEqualTo('�');
    assertThat(stream.getChar()).isEqualTo('a');
  }

  @Test
  @DisplayName("Should stop plain-text reads at the first control character")
  void readNonControlCharacters_StopsAtControl() throws Exception {
    final byte[] bytes = "abc\u001b[0m".getBytes(StandardCharsets.UTF_8);
    stream.appendBytes(bytes, 0, bytes.length);

    assertThat(stream.readNonControlCharacters(10)).isEqualTo("abc");
    assertThat(stream.getChar()).isEqualTo('\u001b');
  }

  @Test
  @DisplayName("Should return pushed-back characters first and in order")
  void pushBackBuffer_ReturnsCharsInOrder() throws Exception {
    final byte[] bytes = "z".getBytes(StandardCharsets.UTF_8);
    stream.appendBytes(bytes, 0, 1);

    stream.pushBackBuffer(new char[] {'x', 'y'}, 2);
    stream.pushChar('w');

    assertThat(stream.readNonControlCharacters(10)).isEqualTo("wxyz");
  }

  @Test
  @DisplayName("Should signal end of data without blocking when drained")
  void getChar_Empty_ThrowsEof() {
    assertThatThrownBy(stream::getChar).isInstanceOf(TerminalDataStream.EOF.class);
  }
}
