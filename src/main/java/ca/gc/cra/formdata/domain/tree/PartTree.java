package ca.gc.cra.formdata.domain.tree;

import ca.gc.cra.formdata.domain.part.NamedPart;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Accumulated part structure for one encoded value, before path names are assigned.
 * <p><strong>Why:</strong> The builder returns subtrees from its recursion instead of mutating shared state, so one
 * tree exists per encode call and is flattened exactly once.</p>
 * <p><strong>Role:</strong> Domain tagged variant: {@link Single} leaf, {@link Keyed} record, {@link Indexed}
 * sequence.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface PartTree permits PartTree.Single, PartTree.Keyed, PartTree.Indexed {

  /**
   * Flattens the tree into parts in depth-first, pre-order order, starting from an empty path.
   *
   * @return ordered parts; empty when the tree holds no leaves
   */
  default List<NamedPart> namedParts() {
    List<NamedPart> out = new ArrayList<>();
    collect(this, "", out);
    return List.copyOf(out);
  }

  /**
   * Path of a record field below {@code prefix}: the bare key at the top level, bracketed otherwise.
   *
   * @param prefix parent path; empty at the top level
   * @param key field name
   * @return child path
   */
  static String keyedPath(String prefix, String key) {
    return prefix.isEmpty() ? key : prefix + "[" + key + "]";
  }

  /**
   * Path of a sequence element below {@code prefix}; always bracketed, even at the top level.
   *
   * @param prefix parent path
   * @param index zero-based element index
   * @return child path
   */
  static String indexedPath(String prefix, int index) {
    return prefix + "[" + index + "]";
  }

  private static void collect(PartTree tree, String prefix, List<NamedPart> out) {
    if (tree instanceof Single single) {
      out.add(new NamedPart(prefix, single.filename(), single.contentType(), single.body));
    } else if (tree instanceof Keyed keyed) {
      for (Keyed.Entry entry : keyed.entries()) {
        collect(entry.child(), keyedPath(prefix, entry.key()), out);
      }
    } else if (tree instanceof Indexed indexed) {
      for (Indexed.Slot slot : indexed.slots()) {
        collect(slot.child(), indexedPath(prefix, slot.index()), out);
      }
    }
  }

  /**
   * One leaf part.
   *
   * @param body payload; copied
   * @param contentType MIME type header value; may be {@code null}
   * @param filename filename; may be {@code null}
   */
  record Single(byte[] body, String contentType, String filename) implements PartTree {
    public Single {
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
      if (!(o instanceof Single other)) {
        return false;
      }
      return Arrays.equals(body, other.body)
          && Objects.equals(contentType, other.contentType)
          && Objects.equals(filename, other.filename);
    }

    @Override
    public int hashCode() {
      int result = Arrays.hashCode(body);
      result = 31 * result + Objects.hashCode(contentType);
      result = 31 * result + Objects.hashCode(filename);
      return result;
    }

    @Override
    public String toString() {
      return "Single{bodyLength=" + body.length + ", contentType=" + contentType
          + ", filename=" + filename + '}';
    }
  }

  /**
   * Record subtree; entries keep declaration order.
   *
   * @param entries present fields only
   */
  record Keyed(List<Entry> entries) implements PartTree {
    public Keyed {
      entries = List.copyOf(entries);
    }

    /**
     * Field of a keyed subtree.
     *
     * @param key field name
     * @param child encoded field value
     */
    public record Entry(String key, PartTree child) {
      public Entry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(child, "child");
      }
    }
  }

  /**
   * Sequence subtree; slots keep the element's position in the source sequence.
   *
   * @param slots present elements only, ascending by index
   */
  record Indexed(List<Slot> slots) implements PartTree {
    public Indexed {
      slots = List.copyOf(slots);
    }

    /**
     * Element of an indexed subtree.
     *
     * @param index zero-based position in the source sequence
     * @param child encoded element
     */
    public record Slot(int index, PartTree child) {
      public Slot {
        if (index < 0) {
          throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(child, "child");
      }
    }
  }
}
