package ca.gc.cra.formdata.application.port;

import ca.gc.cra.formdata.domain.value.Traversable;

/**
 * <strong>What:</strong> Port that reveals one level of a value's shape.
 * <p><strong>Why:</strong> Keeps the part tree builder independent of how fields are discovered (reflection, bean
 * metadata, hand-written mappings).</p>
 * <p><strong>Role:</strong> Port implemented by {@code ReflectiveValueIntrospector}; wrap it to add custom types.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report record fields and sequence elements in a stable, deterministic order.</li>
 *   <li>Produce leaf payloads with optional MIME type and filename.</li>
 *   <li>Return {@link Traversable.Absent} for missing optional values.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use; encoders are shared.</p>
 *
 * @implNote Callers assume {@link #describe(Object, EncodingContext)} never returns {@code null}.
 * @since 0.1.0
 */
public interface ValueIntrospector {
  /**
   * Describes the top level of {@code value}; children are described by later calls.
   *
   * @param value value to inspect; may be {@code null}
   * @param context caller context; must not be mutated
   * @return shape of the value
   * @throws Exception if the value cannot be inspected (e.g., an accessor throws)
   */
  Traversable describe(Object value, EncodingContext context) throws Exception;
}
