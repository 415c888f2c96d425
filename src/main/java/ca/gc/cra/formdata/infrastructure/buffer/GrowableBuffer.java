package ca.gc.cra.formdata.infrastructure.buffer;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Expandable byte sink backed by a single array with a manual write index.
 * <p>Multipart output is appended in place with amortized O(1) growth; the written region can be read back as a
 * copy or as a read-only {@link ByteBuffer} view. Not thread-safe.
 */
public final class GrowableBuffer {
  private static final int DEFAULT_CAPACITY = 2048;
  private static final int MAX_CAPACITY = 1 << 30; // 1 GiB safety guard

  private byte[] data;
  private int writeIndex;

  /**
   * Creates a buffer using the default initial capacity.
   */
  public GrowableBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, align(initialCapacity))];
  }

  /**
   * Appends a single byte into the buffer.
   */
  public void writeByte(byte value) {
    ensureWritable(1);
    data[writeIndex++] = value;
  }

  /**
   * Appends the provided bytes into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   */
  public void write(byte[] src) {
    Objects.requireNonNull(src, "src");
    write(src, 0, src.length);
  }

  /**
   * Appends a region of the provided array into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   * @param offset starting offset within {@code src}
   * @param length number of bytes to append
   */
  public void write(byte[] src, int offset, int length) {
    Objects.requireNonNull(src, "src");
    if (length <= 0) {
      return;
    }
    if (offset < 0 || offset + length > src.length) {
      throw new IndexOutOfBoundsException("invalid offset/length");
    }
    ensureWritable(length);
    System.arraycopy(src, offset, data, writeIndex, length);
    writeIndex += length;
  }

  /**
   * Appends the remaining bytes of {@code src}; the source position is not modified.
   *
   * @param src source buffer; must not be {@code null}
   */
  public void write(ByteBuffer src) {
    Objects.requireNonNull(src, "src");
    int length = src.remaining();
    if (length == 0) {
      return;
    }
    ensureWritable(length);
    src.duplicate().get(data, writeIndex, length);
    writeIndex += length;
  }

  /**
   * Returns the number of readable bytes.
   */
  public int readableBytes() {
    return writeIndex;
  }

  /**
   * Copies all readable bytes into a freshly allocated array without consuming them.
   */
  public byte[] toByteArray() {
    byte[] out = new byte[readableBytes()];
    System.arraycopy(data, 0, out, 0, out.length);
    return out;
  }

  /**
   * Copies all readable bytes into a freshly allocated array and consumes them.
   */
  public byte[] copyAll() {
    byte[] out = toByteArray();
    clear();
    return out;
  }

  /**
   * Exposes the readable region as a read-only {@link ByteBuffer} view.
   */
  public ByteBuffer readableBuffer() {
    return ByteBuffer.wrap(data, 0, writeIndex).asReadOnlyBuffer();
  }

  /**
   * Ensures at least {@code minWritableBytes} bytes can be appended without reallocating.
   */
  public void ensureWritable(int minWritableBytes) {
    if (minWritableBytes <= 0) {
      return;
    }
    int writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    long required = (long) writeIndex + minWritableBytes;
    if (required > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + required);
    }
    int newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity <<= 1;
    }
    byte[] next = new byte[newCapacity];
    System.arraycopy(data, 0, next, 0, writeIndex);
    data = next;
  }

  /**
   * Clears the buffer content without shrinking its capacity.
   */
  public void clear() {
    writeIndex = 0;
  }

  private static int align(int value) {
    int n = 1;
    while (n < value && n < MAX_CAPACITY) {
      n <<= 1;
    }
    return n;
  }
}
