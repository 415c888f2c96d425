package ca.gc.cra.formdata.config;

import ca.gc.cra.formdata.validation.Numbers;
import ca.gc.cra.formdata.validation.Strings;

/**
 * <strong>What:</strong> Immutable encoder configuration.
 * <p><strong>Why:</strong> Supplies the defaults applied to file-typed values and the nesting guard used while
 * walking values.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@code FormDataEncoder} and {@code PartTreeBuilder}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param defaultFileContentType {@code Content-Type} used for file values that declare none
 * @param defaultFilename filename used for file values that declare none
 * @param maxDepth maximum nesting depth of records and sequences below the root
 * @since 0.1.0
 */
public record EncoderConfig(String defaultFileContentType, String defaultFilename, int maxDepth) {
  /** Content type applied to file values without one. */
  public static final String OCTET_STREAM = "application/octet-stream";
  /** Placeholder filename applied to file values without one. */
  public static final String PLACEHOLDER_FILENAME = "file";
  /** Default nesting limit; deep enough for real forms, shallow enough to stop cyclic graphs early. */
  public static final int DEFAULT_MAX_DEPTH = 64;

  /**
   * Validates the configuration values.
   *
   * @throws IllegalArgumentException when a value is blank, contains control characters, or is out of range
   */
  public EncoderConfig {
    defaultFileContentType = Strings.requirePrintableAscii("defaultFileContentType", defaultFileContentType, 255);
    defaultFilename = Strings.requireNonBlank("defaultFilename", defaultFilename);
    Numbers.requireRange("maxDepth", maxDepth, 1, 4096);
  }

  /**
   * Provides default configuration values used when no external config is supplied.
   *
   * @return default configuration record
   */
  public static EncoderConfig defaults() {
    return new EncoderConfig(OCTET_STREAM, PLACEHOLDER_FILENAME, DEFAULT_MAX_DEPTH);
  }
}
