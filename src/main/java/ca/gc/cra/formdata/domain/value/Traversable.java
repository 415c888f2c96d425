package ca.gc.cra.formdata.domain.value;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One level of a value's shape as seen by the part tree builder.
 * <p><strong>Why:</strong> Decouples the builder from how values are inspected; reflective discovery and hand-built
 * mappings both end up as the same four variants.</p>
 * <p><strong>Role:</strong> Domain contract returned by {@code ValueIntrospector#describe}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link Record}: ordered named fields whose values are described on demand.</li>
 *   <li>{@link Sequence}: ordered unnamed elements whose values are described on demand.</li>
 *   <li>{@link Leaf}: payload bytes plus optional MIME type and filename.</li>
 *   <li>{@link Absent}: a missing optional value; contributes no parts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Variants are immutable; child values are whatever the caller supplied.</p>
 *
 * @since 0.1.0
 */
public sealed interface Traversable
    permits Traversable.Record, Traversable.Sequence, Traversable.Leaf, Traversable.Absent {

  /**
   * Starts a hand-built record.
   *
   * @return empty record builder
   */
  static RecordBuilder record() {
    return new RecordBuilder();
  }

  /**
   * Creates a sequence over the supplied elements.
   *
   * @param elements child values, raw or already {@link Traversable}
   * @return sequence variant
   */
  static Sequence sequence(Object... elements) {
    return new Sequence(Arrays.asList(elements));
  }

  /**
   * Creates a UTF-8 text leaf.
   *
   * @param text leaf text; must not be {@code null}
   * @return text leaf
   */
  static Leaf text(String text) {
    Objects.requireNonNull(text, "text");
    return new Leaf(Leaf.Kind.TEXT, text.getBytes(StandardCharsets.UTF_8), null, null);
  }

  /**
   * Creates a raw binary leaf with no content type or filename.
   *
   * @param bytes payload; copied
   * @return binary leaf
   */
  static Leaf binary(byte[] bytes) {
    return new Leaf(Leaf.Kind.BINARY, bytes, null, null);
  }

  /**
   * Creates a file leaf; missing metadata is filled from encoder defaults during building.
   *
   * @param file file value; must not be {@code null}
   * @return file leaf
   */
  static Leaf file(FormFile file) {
    Objects.requireNonNull(file, "file");
    return new Leaf(Leaf.Kind.FILE, file.bytes(), file.contentType(), file.filename());
  }

  /**
   * Named field of a record. The value is read through {@link Accessor} when the builder reaches the field, so a
   * failing getter is reported against the field's own path.
   *
   * @param name field name as it should appear in the part path
   * @param accessor reads the raw child value or a {@link Traversable}; a {@code null} result means absent
   */
  record Field(String name, Accessor accessor) {
    public Field {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(accessor, "accessor");
    }

    /**
     * Creates a field over an already available value.
     *
     * @param name field name
     * @param value raw value, {@link Traversable}, or {@code null} for absent
     * @return eager field
     */
    public static Field of(String name, Object value) {
      return new Field(name, () -> value);
    }

    /**
     * Reads the field value.
     *
     * @return raw value; {@code null} when absent
     * @throws Exception when the underlying accessor fails
     */
    public Object value() throws Exception {
      return accessor.get();
    }
  }

  /** Deferred read of a field value. */
  @FunctionalInterface
  interface Accessor {
    Object get() throws Exception;
  }

  /**
   * Record-like value: named fields in declaration order.
   *
   * @param fields ordered fields; copied
   */
  record Record(List<Field> fields) implements Traversable {
    public Record {
      fields = List.copyOf(fields);
    }
  }

  /**
   * Sequence-like value: elements in index order.
   *
   * @param elements ordered children; may contain {@code null} for absent elements
   */
  record Sequence(List<?> elements) implements Traversable {
    public Sequence {
      elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }
  }

  /**
   * Scalar or binary leaf.
   *
   * @param kind how the leaf was produced; only {@link Kind#FILE} receives file headers
   * @param body payload bytes; copied
   * @param contentType declared MIME type; may be {@code null}
   * @param filename declared filename; may be {@code null}
   */
  record Leaf(Kind kind, byte[] body, String contentType, String filename) implements Traversable {

    /** Origin of a leaf payload. */
    public enum Kind {
      /** Textual encoding of a scalar. */
      TEXT,
      /** Raw bytes without metadata. */
      BINARY,
      /** File-typed value; carries content type and filename headers. */
      FILE
    }

    public Leaf {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(body, "body");
      body = body.clone();
    }

    @Override
    public byte[] body() {
      return body.clone();
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Leaf other)) {
        return false;
      }
      return kind == other.kind
          && Arrays.equals(body, other.body)
          && Objects.equals(contentType, other.contentType)
          && Objects.equals(filename, other.filename);
    }

    @Override
    public int hashCode() {
      int result = kind.hashCode();
      result = 31 * result + Arrays.hashCode(body);
      result = 31 * result + Objects.hashCode(contentType);
      result = 31 * result + Objects.hashCode(filename);
      return result;
    }

    @Override
    public String toString() {
      return "Leaf{kind=" + kind + ", bodyLength=" + body.length
          + ", contentType=" + contentType + ", filename=" + filename + '}';
    }
  }

  /** Missing optional value. */
  enum Absent implements Traversable {
    INSTANCE
  }

  /** Fluent builder for hand-mapped records. */
  final class RecordBuilder {
    private final List<Field> fields = new ArrayList<>();

    private RecordBuilder() {}

    /**
     * Appends a field; {@code null} values are kept and later treated as absent.
     *
     * @param name field name
     * @param value raw value or {@link Traversable}
     * @return this builder
     */
    public RecordBuilder field(String name, Object value) {
      fields.add(Field.of(name, value));
      return this;
    }

    /**
     * Appends a field read on demand.
     *
     * @param name field name
     * @param accessor reads the value when the field is visited
     * @return this builder
     */
    public RecordBuilder lazyField(String name, Accessor accessor) {
      fields.add(new Field(name, accessor));
      return this;
    }

    public Record build() {
      return new Record(fields);
    }
  }
}
