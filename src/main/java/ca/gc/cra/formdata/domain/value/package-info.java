/**
 * Shapes that values take on their way into multipart parts.
 * <p><strong>Role:</strong> Domain contracts shared by the introspection adapters and the part tree builder.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.domain.value;
