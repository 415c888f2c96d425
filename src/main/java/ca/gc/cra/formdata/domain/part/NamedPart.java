package ca.gc.cra.formdata.domain.part;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A single {@code multipart/form-data} body part: field name, optional file metadata, and
 * the exact payload bytes.
 * <p><strong>Why:</strong> The unit exchanged between the part tree builder and the multipart serializer.</p>
 * <p><strong>Role:</strong> Domain value object; produced by {@code PartTree#namedParts()} and consumed by
 * {@code MultipartSerializer}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the body is copied on the way in and on the way out.</p>
 * <p><strong>Performance:</strong> One defensive copy per construction and per {@link #body()} call; serializers
 * use {@link #bodyView()} to avoid the second copy.</p>
 *
 * @param name form field name; duplicates are allowed and represent multi-valued fields
 * @param filename filename reported in {@code Content-Disposition}; {@code null} for non-file parts
 * @param contentType MIME type for the {@code Content-Type} header; {@code null} suppresses the header
 * @param body exact payload; never transformed
 * @since 0.1.0
 */
public record NamedPart(String name, String filename, String contentType, byte[] body) {

  /**
   * Validates and copies the supplied components.
   *
   * @throws NullPointerException if {@code name} or {@code body} is {@code null}
   * @throws IllegalArgumentException if {@code contentType} contains CR or LF
   */
  public NamedPart {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(body, "body");
    if (contentType != null && (contentType.indexOf('\r') >= 0 || contentType.indexOf('\n') >= 0)) {
      throw new IllegalArgumentException("contentType must not contain line breaks");
    }
    body = body.clone();
  }

  /**
   * Creates a plain field part without file metadata or content type.
   *
   * @param name form field name
   * @param body payload bytes
   * @return part carrying only a name and body
   */
  public static NamedPart field(String name, byte[] body) {
    return new NamedPart(name, null, null, body);
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  /** Returns the payload length in bytes. */
  public int bodyLength() {
    return body.length;
  }

  /** Exposes the payload as a read-only view without copying. */
  public ByteBuffer bodyView() {
    return ByteBuffer.wrap(body).asReadOnlyBuffer();
  }

  public Optional<String> filenameValue() {
    return Optional.ofNullable(filename);
  }

  public Optional<String> contentTypeValue() {
    return Optional.ofNullable(contentType);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NamedPart other)) {
      return false;
    }
    return name.equals(other.name)
        && Objects.equals(filename, other.filename)
        && Objects.equals(contentType, other.contentType)
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    int result = name.hashCode();
    result = 31 * result + Objects.hashCode(filename);
    result = 31 * result + Objects.hashCode(contentType);
    result = 31 * result + Arrays.hashCode(body);
    return result;
  }

  @Override
  public String toString() {
    return "NamedPart{"
        + "name=" + name
        + ", filename=" + filename
        + ", contentType=" + contentType
        + ", bodyLength=" + body.length
        + '}';
  }
}
