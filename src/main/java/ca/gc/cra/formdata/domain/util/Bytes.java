package ca.gc.cra.formdata.domain.util;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * <strong>What:</strong> Byte search helpers for payload scanning.
 * <p><strong>Why:</strong> The serializer must prove a delimiter never occurs inside a part body before writing it.</p>
 * <p><strong>Role:</strong> Domain support functions reused by the serializer and the growable buffer.</p>
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single left-to-right pass with a first-byte skip; O(n*m) worst case for
 * pathological inputs, O(n) for typical boundaries.</p>
 *
 * @since 0.1.0
 */
public final class Bytes {
  private Bytes() {}

  /**
   * Finds the first occurrence of {@code needle} in the remaining bytes of {@code haystack}.
   *
   * @param haystack buffer to scan; position and limit are not modified
   * @param needle sequence to find; must not be {@code null}
   * @return offset relative to {@code haystack.position()}, or {@code -1} when absent; {@code 0} for an empty needle
   */
  public static int indexOf(ByteBuffer haystack, byte[] needle) {
    Objects.requireNonNull(haystack, "haystack");
    Objects.requireNonNull(needle, "needle");
    int start = haystack.position();
    int end = haystack.limit();
    int needleLen = needle.length;
    if (needleLen == 0) {
      return 0;
    }
    int limit = end - needleLen;
    byte first = needle[0];
    outer:
    for (int i = start; i <= limit; i++) {
      if (haystack.get(i) != first) {
        continue;
      }
      for (int j = 1; j < needleLen; j++) {
        if (haystack.get(i + j) != needle[j]) {
          continue outer;
        }
      }
      return i - start;
    }
    return -1;
  }

  /**
   * Finds the first occurrence of {@code needle} in {@code haystack}.
   *
   * @param haystack array to scan; must not be {@code null}
   * @param needle sequence to find; must not be {@code null}
   * @return index of the first match or {@code -1}
   */
  public static int indexOf(byte[] haystack, byte[] needle) {
    Objects.requireNonNull(haystack, "haystack");
    return indexOf(ByteBuffer.wrap(haystack), needle);
  }
}
