package ca.gc.cra.formdata.domain.error;

import java.util.Objects;
import java.util.Optional;

/**
 * Checked exception raised when a value cannot be represented as {@code multipart/form-data} with the requested
 * boundary. No output is produced when it is thrown.
 *
 * @since 0.1.0
 */
public final class FormDataEncodingException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Failure categories surfaced to callers. */
  public enum Reason {
    /** The top-level value is not record-like. */
    ROOT_NOT_KEYED,
    /** A part name or filename is empty or contains CR/LF. */
    INVALID_PART_NAME,
    /** A part body contains {@code "--" + boundary}. */
    BOUNDARY_COLLISION,
    /** Inspecting the value failed; the cause is the original exception. */
    TRAVERSAL_FAILURE
  }

  private final Reason reason;
  private final String path;

  private FormDataEncodingException(Reason reason, String path, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.path = path;
  }

  /**
   * Creates a failure for a root value that exposes no named fields.
   *
   * @param shape description of what the root turned out to be
   * @return exception tagged {@link Reason#ROOT_NOT_KEYED}
   */
  public static FormDataEncodingException rootNotKeyed(String shape) {
    return new FormDataEncodingException(Reason.ROOT_NOT_KEYED, "",
        "Top-level value must expose named fields but was " + shape, null);
  }

  /**
   * Creates a failure for an unusable part name or filename.
   *
   * @param name offending part name, already truncated for display
   * @param detail what is wrong with it
   * @return exception tagged {@link Reason#INVALID_PART_NAME}
   */
  public static FormDataEncodingException invalidPartName(String name, String detail) {
    return new FormDataEncodingException(Reason.INVALID_PART_NAME, name,
        "Invalid part name '" + name + "': " + detail, null);
  }

  /**
   * Creates a failure for a body that contains the boundary delimiter.
   *
   * @param name part whose body collides, already truncated for display
   * @param offset byte offset of the first match inside the body
   * @return exception tagged {@link Reason#BOUNDARY_COLLISION}
   */
  public static FormDataEncodingException boundaryCollision(String name, int offset) {
    return new FormDataEncodingException(Reason.BOUNDARY_COLLISION, name,
        "Body of part '" + name + "' contains the boundary delimiter at offset " + offset, null);
  }

  /**
   * Wraps an introspection failure with the path that was being visited.
   *
   * @param path part path under inspection; empty for the root value
   * @param cause original failure; may be {@code null} for failures detected by the builder itself
   * @param detail short description
   * @return exception tagged {@link Reason#TRAVERSAL_FAILURE}
   */
  public static FormDataEncodingException traversalFailure(String path, String detail, Throwable cause) {
    String where = path.isEmpty() ? "<root>" : path;
    return new FormDataEncodingException(Reason.TRAVERSAL_FAILURE, path,
        "Failed to traverse value at " + where + ": " + detail, cause);
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Part path or part name associated with the failure.
   *
   * @return path when known; empty for the root or when not applicable
   */
  public Optional<String> path() {
    return path == null || path.isEmpty() ? Optional.empty() : Optional.of(path);
  }
}
