package ca.gc.cra.formdata.application.encode;

import ca.gc.cra.formdata.application.port.EncodingContext;
import ca.gc.cra.formdata.application.port.ValueIntrospector;
import ca.gc.cra.formdata.config.EncoderConfig;
import ca.gc.cra.formdata.domain.error.FormDataEncodingException;
import ca.gc.cra.formdata.domain.part.NamedPart;
import ca.gc.cra.formdata.domain.tree.PartTree;
import ca.gc.cra.formdata.domain.value.Traversable;
import ca.gc.cra.formdata.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Walks a structured value and produces its {@link PartTree}.
 * <p><strong>Why:</strong> Multipart bodies are flat; nested records and sequences must be folded into bracketed
 * part names ({@code address[city]}, {@code tags[0]}).</p>
 * <p><strong>Role:</strong> Application use case between the {@link ValueIntrospector} port and the serializer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Visit fields and elements depth-first in the order the introspector reports them.</li>
 *   <li>Omit absent values and contribute nothing for empty containers.</li>
 *   <li>Apply file defaults from {@link EncoderConfig} to file-typed leaves; blank values count as missing.</li>
 *   <li>Reject declared content types that would break the part header.</li>
 *   <li>Tag introspection failures with the path being visited.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; the path and the tree are call-local, so one builder serves
 * concurrent encodes.</p>
 * <p><strong>Performance:</strong> O(leaves + containers); each value is described exactly once.</p>
 *
 * @since 0.1.0
 */
public final class PartTreeBuilder {
  private final ValueIntrospector introspector;
  private final EncoderConfig config;

  /**
   * Creates a builder.
   *
   * @param introspector source of value shapes; must not be {@code null}
   * @param config file defaults and nesting limit; must not be {@code null}
   */
  public PartTreeBuilder(ValueIntrospector introspector, EncoderConfig config) {
    this.introspector = Objects.requireNonNull(introspector, "introspector");
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Builds the part tree of a record-like root value.
   *
   * @param root value to encode
   * @param context caller context passed to the introspector unchanged; must not be {@code null}
   * @return keyed tree holding every present leaf
   * @throws FormDataEncodingException {@code ROOT_NOT_KEYED} when the root is not record-like;
   *     {@code TRAVERSAL_FAILURE} when inspecting any value fails or nesting exceeds the limit
   */
  public PartTree build(Object root, EncodingContext context) throws FormDataEncodingException {
    Objects.requireNonNull(context, "context");
    Traversable shape = describe(root, "", context);
    if (!(shape instanceof Traversable.Record record)) {
      throw FormDataEncodingException.rootNotKeyed(shapeName(shape));
    }
    return keyed(record, "", 0, context);
  }

  /**
   * Builds the tree and flattens it into parts.
   *
   * @param root value to encode
   * @param context caller context
   * @return ordered parts
   * @throws FormDataEncodingException as for {@link #build(Object, EncodingContext)}
   */
  public List<NamedPart> parts(Object root, EncodingContext context) throws FormDataEncodingException {
    return build(root, context).namedParts();
  }

  // Returns null for absent values.
  private PartTree visit(Object value, String path, int depth, EncodingContext context)
      throws FormDataEncodingException {
    Traversable shape = describe(value, path, context);
    if (shape instanceof Traversable.Leaf leaf) {
      return single(leaf, path);
    }
    if (shape instanceof Traversable.Record record) {
      return keyed(record, path, depth, context);
    }
    if (shape instanceof Traversable.Sequence sequence) {
      return indexed(sequence, path, depth, context);
    }
    return null;
  }

  private PartTree.Keyed keyed(Traversable.Record record, String path, int depth, EncodingContext context)
      throws FormDataEncodingException {
    checkDepth(path, depth);
    List<PartTree.Keyed.Entry> entries = new ArrayList<>(record.fields().size());
    for (Traversable.Field field : record.fields()) {
      String childPath = PartTree.keyedPath(path, field.name());
      PartTree child = visit(read(field, childPath), childPath, depth + 1, context);
      if (child != null) {
        entries.add(new PartTree.Keyed.Entry(field.name(), child));
      }
    }
    return new PartTree.Keyed(entries);
  }

  private PartTree.Indexed indexed(Traversable.Sequence sequence, String path, int depth,
      EncodingContext context) throws FormDataEncodingException {
    checkDepth(path, depth);
    List<?> elements = sequence.elements();
    List<PartTree.Indexed.Slot> slots = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      PartTree child = visit(elements.get(i), PartTree.indexedPath(path, i), depth + 1, context);
      if (child != null) {
        slots.add(new PartTree.Indexed.Slot(i, child));
      }
    }
    return new PartTree.Indexed(slots);
  }

  private static Object read(Traversable.Field field, String path) throws FormDataEncodingException {
    try {
      return field.value();
    } catch (Exception ex) {
      throw FormDataEncodingException.traversalFailure(Logs.partName(path), ex.toString(), ex);
    }
  }

  private PartTree.Single single(Traversable.Leaf leaf, String path) throws FormDataEncodingException {
    String contentType = leaf.contentType();
    String filename = leaf.filename();
    if (contentType != null && (contentType.indexOf('\r') >= 0 || contentType.indexOf('\n') >= 0)) {
      throw FormDataEncodingException.invalidPartName(
          Logs.partName(path), "contentType must not contain line breaks");
    }
    if (leaf.kind() == Traversable.Leaf.Kind.FILE) {
      if (contentType == null || contentType.isBlank()) {
        contentType = config.defaultFileContentType();
      }
      if (filename == null || filename.isBlank()) {
        filename = config.defaultFilename();
      }
    }
    return new PartTree.Single(leaf.body(), contentType, filename);
  }

  private Traversable describe(Object value, String path, EncodingContext context)
      throws FormDataEncodingException {
    Traversable shape;
    try {
      shape = introspector.describe(value, context);
    } catch (FormDataEncodingException ex) {
      throw ex;
    } catch (Exception ex) {
      throw FormDataEncodingException.traversalFailure(Logs.partName(path), ex.toString(), ex);
    }
    if (shape == null) {
      throw FormDataEncodingException.traversalFailure(Logs.partName(path),
          "introspector returned no shape for "
              + (value == null ? "null" : value.getClass().getName()), null);
    }
    return shape;
  }

  private void checkDepth(String path, int depth) throws FormDataEncodingException {
    if (depth > config.maxDepth()) {
      throw FormDataEncodingException.traversalFailure(Logs.partName(path),
          "nesting depth exceeds " + config.maxDepth() + " (cyclic value?)", null);
    }
  }

  private static String shapeName(Traversable shape) {
    if (shape instanceof Traversable.Sequence) {
      return "a sequence";
    }
    if (shape instanceof Traversable.Leaf) {
      return "a scalar";
    }
    return "absent";
  }
}
