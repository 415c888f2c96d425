/**
 * <strong>Purpose:</strong> Public entry point for encoding structured values as {@code multipart/form-data}.
 * <p><strong>Pipeline role:</strong> Composes the part tree builder, the multipart serializer, configuration, and
 * metrics.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.formdata.api.FormDataEncoder} is immutable and shareable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.api;
