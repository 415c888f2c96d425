package ca.gc.cra.formdata.domain.util;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> UTF-8 conversions used for header text and textual output.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Delegates to the JDK codecs; no intermediate copies beyond the result.</p>
 *
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Encodes text as UTF-8.
   *
   * @param text text to encode; {@code null} yields an empty array
   * @return encoded bytes
   */
  public static byte[] encode(String text) {
    if (text == null || text.isEmpty()) {
      return new byte[0];
    }
    return text.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Decodes a UTF-8 slice; malformed sequences become U+FFFD.
   *
   * @param data backing array; may be {@code null}
   * @param offset starting offset within the array
   * @param length number of bytes to decode
   * @return decoded string or an empty string when inputs are {@code null} or empty
   */
  public static String decode(byte[] data, int offset, int length) {
    if (data == null || length <= 0) {
      return "";
    }
    int start = Math.max(0, Math.min(data.length, offset));
    int len = Math.max(0, Math.min(length, data.length - start));
    if (len == 0) {
      return "";
    }
    return new String(data, start, len, StandardCharsets.UTF_8);
  }
}
