package ca.gc.cra.formdata.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class GrowableBufferTest {
  @Test
  void growsPastInitialCapacity() {
    GrowableBuffer buffer = new GrowableBuffer(4);
    byte[] payload = new byte[1000];
    for (int i = 0; i < payload.length; i++) {
      payload[i] = (byte) i;
    }

    buffer.write(payload);
    buffer.writeByte((byte) 7);

    assertEquals(1001, buffer.readableBytes());
    byte[] out = buffer.toByteArray();
    assertEquals(7, out[1000]);
    assertEquals((byte) 999, out[999]);
  }

  @Test
  void writeByteBufferLeavesSourcePositionAlone() {
    GrowableBuffer buffer = new GrowableBuffer();
    ByteBuffer source = ByteBuffer.wrap(ascii("hello"));
    source.position(1);

    buffer.write(source);

    assertEquals(1, source.position());
    assertArrayEquals(ascii("ello"), buffer.toByteArray());
  }

  @Test
  void writeRegionValidatesBounds() {
    GrowableBuffer buffer = new GrowableBuffer();

    buffer.write(ascii("abcdef"), 2, 3);

    assertArrayEquals(ascii("cde"), buffer.toByteArray());
    assertThrows(IndexOutOfBoundsException.class, () -> buffer.write(ascii("ab"), 1, 5));
  }

  @Test
  void copyAllDrainsButKeepsCapacity() {
    GrowableBuffer buffer = new GrowableBuffer();
    buffer.write(ascii("abc"));

    assertArrayEquals(ascii("abc"), buffer.copyAll());
    assertEquals(0, buffer.readableBytes());
    buffer.write(ascii("d"));
    assertArrayEquals(ascii("d"), buffer.toByteArray());
  }

  @Test
  void readableViewCoversWrittenRegionOnly() {
    GrowableBuffer buffer = new GrowableBuffer();
    buffer.write(ascii("x--b"));

    ByteBuffer view = buffer.readableBuffer();
    assertTrue(view.isReadOnly());
    assertEquals(4, view.remaining());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new GrowableBuffer(0));
  }

  @Test
  void clearResetsContent() {
    GrowableBuffer buffer = new GrowableBuffer();
    buffer.write(ascii("abc"));
    buffer.clear();

    assertEquals(0, buffer.readableBytes());
    assertEquals(0, buffer.toByteArray().length);
  }

  private static byte[] ascii(String text) {
    return text.getBytes(StandardCharsets.US_ASCII);
  }
}
