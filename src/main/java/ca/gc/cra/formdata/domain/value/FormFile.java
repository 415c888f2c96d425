package ca.gc.cra.formdata.domain.value;

import java.util.Arrays;
import java.util.Objects;

/**
 * File-typed form value. Encodes as a single part carrying {@code filename} and {@code Content-Type} headers;
 * absent metadata is replaced by the encoder's configured defaults.
 *
 * @param filename filename to report; {@code null} to use the default placeholder
 * @param contentType MIME type; {@code null} to use the default ({@code application/octet-stream})
 * @param bytes file content; copied
 * @since 0.1.0
 */
public record FormFile(String filename, String contentType, byte[] bytes) {

  public FormFile {
    Objects.requireNonNull(bytes, "bytes");
    bytes = bytes.clone();
  }

  /**
   * Creates a file value with content only; both headers fall back to defaults.
   *
   * @param bytes file content
   * @return file value without metadata
   */
  public static FormFile of(byte[] bytes) {
    return new FormFile(null, null, bytes);
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FormFile other)) {
      return false;
    }
    return Objects.equals(filename, other.filename)
        && Objects.equals(contentType, other.contentType)
        && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    int result = Objects.hashCode(filename);
    result = 31 * result + Objects.hashCode(contentType);
    result = 31 * result + Arrays.hashCode(bytes);
    return result;
  }

  @Override
  public String toString() {
    return "FormFile{filename=" + filename + ", contentType=" + contentType + ", size=" + bytes.length + '}';
  }
}
