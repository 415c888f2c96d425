package ca.gc.cra.formdata.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied to the encoder by callers and configuration.
 * <p><strong>Why:</strong> Rejects boundaries and header values that would corrupt multipart framing before any
 * output is produced.
 * <p><strong>Role:</strong> Support utilities invoked by the serializer and configuration loaders.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via code or config files.</li>
 *   <li>Enforce the RFC 2046 boundary grammar.</li>
 *   <li>Verify printable ASCII constraints for header values.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final int MAX_BOUNDARY_LENGTH = 70;
  private static final String BOUNDARY_SPECIALS = "'()+_,-./:=? ";

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed; caller owns the result
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a multipart boundary against the RFC 2046 grammar: 1 to 70 characters from
   * {@code DIGIT / ALPHA / '()+_,-./:=? } and space, not ending with a space. The value is not trimmed.
   *
   * @param boundary candidate boundary; must not be {@code null}
   * @return the boundary unchanged
   * @throws NullPointerException if {@code boundary} is {@code null}
   * @throws IllegalArgumentException if the boundary violates the grammar
   */
  public static String requireBoundary(String boundary) {
    Objects.requireNonNull(boundary, "boundary");
    if (boundary.isEmpty() || boundary.length() > MAX_BOUNDARY_LENGTH) {
      throw new IllegalArgumentException(
          message("boundary", "length must be between 1 and " + MAX_BOUNDARY_LENGTH));
    }
    for (int i = 0; i < boundary.length(); i++) {
      char c = boundary.charAt(i);
      boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
      if (!alnum && BOUNDARY_SPECIALS.indexOf(c) < 0) {
        throw new IllegalArgumentException(message("boundary", "contains unsupported character at " + i));
      }
    }
    if (boundary.charAt(boundary.length() - 1) == ' ') {
      throw new IllegalArgumentException(message("boundary", "must not end with a space"));
    }
    return boundary;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated, trimmed value containing only characters {@code 0x20-0x7E}
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank, exceeds {@code maxLength}, or contains
   *         non-printable ASCII characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
