package ca.gc.cra.formdata.infrastructure.protocol.multipart;

import ca.gc.cra.formdata.domain.error.FormDataEncodingException;
import ca.gc.cra.formdata.domain.part.NamedPart;
import ca.gc.cra.formdata.domain.util.Bytes;
import ca.gc.cra.formdata.domain.util.Utf8;
import ca.gc.cra.formdata.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.formdata.logging.Logs;
import ca.gc.cra.formdata.validation.Strings;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders named parts into the RFC 2388 {@code multipart/form-data} framing:
 * <pre>
 * --boundary CRLF
 * Content-Disposition: form-data; name="..."[; filename="..."] CRLF
 * [Content-Type: ... CRLF]
 * CRLF
 * body CRLF
 * ...
 * --boundary-- CRLF
 * </pre>
 * Every part is validated (name, filename, boundary collision) before the first byte is written, so a failed call
 * leaves the sink untouched. All sinks receive byte-identical output. Stateless and thread-safe.
 */
public final class MultipartSerializer {
  private static final byte[] CRLF = {'\r', '\n'};
  private static final String DISPOSITION = "Content-Disposition: form-data; name=\"";
  private static final String CONTENT_TYPE = "Content-Type: ";

  /**
   * Serializes the parts into a new array sized to the exact output length.
   *
   * @param parts parts in output order; must not be {@code null}
   * @param boundary RFC 2046 boundary without the leading dashes
   * @return complete multipart body
   * @throws FormDataEncodingException when a part name is invalid or a body contains the delimiter
   * @throws IllegalArgumentException when the boundary is not 1 to 70 RFC 2046 boundary characters or ends with
   *     a space
   * @throws IllegalStateException when the output would not fit in a single array
   */
  public byte[] serialize(List<NamedPart> parts, String boundary) throws FormDataEncodingException {
    Frame frame = frame(parts, boundary);
    if (frame.length() > Integer.MAX_VALUE - 8) {
      throw new IllegalStateException("multipart body too large for a byte array: " + frame.length());
    }
    ByteBuffer target = ByteBuffer.allocate((int) frame.length());
    emit(frame, target::put);
    return target.array();
  }

  /**
   * Serializes the parts and decodes the result as UTF-8; bytes that are not valid UTF-8 become U+FFFD, so binary
   * bodies should use {@link #serialize(List, String)} instead.
   *
   * @param parts parts in output order
   * @param boundary RFC 2046 boundary
   * @return multipart body as text
   * @throws FormDataEncodingException as for {@link #serialize(List, String)}
   * @throws IllegalArgumentException when the boundary is malformed
   */
  public String serializeToString(List<NamedPart> parts, String boundary) throws FormDataEncodingException {
    byte[] bytes = serialize(parts, boundary);
    return Utf8.decode(bytes, 0, bytes.length);
  }

  /**
   * Appends the multipart body to {@code sink} without materializing it first.
   *
   * @param parts parts in output order
   * @param boundary RFC 2046 boundary
   * @param sink growable destination; untouched when validation fails
   * @return number of bytes appended
   * @throws FormDataEncodingException as for {@link #serialize(List, String)}
   * @throws IllegalArgumentException when the boundary is malformed
   */
  public long serialize(List<NamedPart> parts, String boundary, GrowableBuffer sink)
      throws FormDataEncodingException {
    Objects.requireNonNull(sink, "sink");
    Frame frame = frame(parts, boundary);
    if (frame.length() <= Integer.MAX_VALUE - 8) {
      sink.ensureWritable((int) frame.length());
    }
    emit(frame, sink::write);
    return frame.length();
  }

  /**
   * Streams the multipart body to {@code out}. The stream is neither flushed nor closed.
   *
   * @param parts parts in output order
   * @param boundary RFC 2046 boundary
   * @param out destination stream; nothing is written when validation fails
   * @return number of bytes written
   * @throws FormDataEncodingException as for {@link #serialize(List, String)}
   * @throws IllegalArgumentException when the boundary is malformed
   * @throws IOException when writing to {@code out} fails
   */
  public long serialize(List<NamedPart> parts, String boundary, OutputStream out)
      throws FormDataEncodingException, IOException {
    Objects.requireNonNull(out, "out");
    Frame frame = frame(parts, boundary);
    WritableByteChannel channel = Channels.newChannel(out);
    emit(frame, channel::write);
    return frame.length();
  }

  /**
   * Escapes a quoted header parameter: backslash and double quote are prefixed with a backslash.
   *
   * @param value parameter value
   * @return escaped value
   */
  static String escape(String value) {
    StringBuilder sb = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"' || c == '\\') {
        if (sb == null) {
          sb = new StringBuilder(value.length() + 8).append(value, 0, i);
        }
        sb.append('\\');
      }
      if (sb != null) {
        sb.append(c);
      }
    }
    return sb == null ? value : sb.toString();
  }

  private static Frame frame(List<NamedPart> parts, String boundary) throws FormDataEncodingException {
    Objects.requireNonNull(parts, "parts");
    Strings.requireBoundary(boundary);
    byte[] dashBoundary = Utf8.encode("--" + boundary);
    List<byte[]> heads = new ArrayList<>(parts.size());
    long length = 0;
    for (NamedPart part : parts) {
      Objects.requireNonNull(part, "part");
      byte[] head = head(boundary, part);
      int hit = Bytes.indexOf(part.bodyView(), dashBoundary);
      if (hit >= 0) {
        throw FormDataEncodingException.boundaryCollision(Logs.partName(part.name()), hit);
      }
      heads.add(head);
      length += head.length + (long) part.bodyLength() + CRLF.length;
    }
    byte[] close = Utf8.encode("--" + boundary + "--\r\n");
    length += close.length;
    return new Frame(parts, heads, close, length);
  }

  private static byte[] head(String boundary, NamedPart part) throws FormDataEncodingException {
    String name = part.name();
    if (name.isEmpty()) {
      throw FormDataEncodingException.invalidPartName(name, "must not be empty");
    }
    requireSingleLine(name, name, "name");
    StringBuilder sb = new StringBuilder(boundary.length() + name.length() + 96);
    sb.append("--").append(boundary).append("\r\n");
    sb.append(DISPOSITION).append(escape(name)).append('"');
    if (part.filename() != null) {
      requireSingleLine(name, part.filename(), "filename");
      sb.append("; filename=\"").append(escape(part.filename())).append('"');
    }
    sb.append("\r\n");
    if (part.contentType() != null) {
      sb.append(CONTENT_TYPE).append(part.contentType()).append("\r\n");
    }
    sb.append("\r\n");
    return Utf8.encode(sb.toString());
  }

  private static void requireSingleLine(String name, String value, String what)
      throws FormDataEncodingException {
    if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
      throw FormDataEncodingException.invalidPartName(Logs.partName(name),
          what + " must not contain line breaks");
    }
  }

  private static <X extends Exception> void emit(Frame frame, ChunkWriter<X> writer) throws X {
    List<NamedPart> parts = frame.parts();
    for (int i = 0; i < parts.size(); i++) {
      writer.write(ByteBuffer.wrap(frame.heads().get(i)));
      writer.write(parts.get(i).bodyView());
      writer.write(ByteBuffer.wrap(CRLF));
    }
    writer.write(ByteBuffer.wrap(frame.close()));
  }

  @FunctionalInterface
  private interface ChunkWriter<X extends Exception> {
    void write(ByteBuffer chunk) throws X;
  }

  private record Frame(List<NamedPart> parts, List<byte[]> heads, byte[] close, long length) {}
}
