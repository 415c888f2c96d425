package ca.gc.cra.formdata.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class BytesTest {
  @Test
  void findsFirstOccurrence() {
    byte[] haystack = ascii("ab--x--xyz");

    assertEquals(2, Bytes.indexOf(haystack, ascii("--x")));
    assertEquals(-1, Bytes.indexOf(haystack, ascii("--q")));
    assertEquals(0, Bytes.indexOf(haystack, new byte[0]));
  }

  @Test
  void needleLongerThanHaystackIsNotFound() {
    assertEquals(-1, Bytes.indexOf(ascii("ab"), ascii("abc")));
  }

  @Test
  void offsetIsRelativeToBufferPositionAndPositionIsUntouched() {
    ByteBuffer buffer = ByteBuffer.wrap(ascii("xx--ab--cd"));
    buffer.position(4);

    assertEquals(2, Bytes.indexOf(buffer, ascii("--")));
    assertEquals(4, buffer.position());
  }

  @Test
  void respectsBufferLimit() {
    ByteBuffer buffer = ByteBuffer.wrap(ascii("abc--"));
    buffer.limit(4);

    assertEquals(-1, Bytes.indexOf(buffer, ascii("--")));
  }

  @Test
  void utf8DecodeClampsRangeAndReplacesMalformedInput() {
    byte[] data = {'o', 'k', (byte) 0xFF};

    assertEquals("ok", Utf8.decode(data, 0, 2));
    assertEquals("k\uFFFD", Utf8.decode(data, 1, 99));
    assertEquals("", Utf8.decode(null, 0, 1));
    assertEquals(0, Utf8.encode(null).length);
  }

  private static byte[] ascii(String text) {
    return text.getBytes(StandardCharsets.US_ASCII);
  }
}
