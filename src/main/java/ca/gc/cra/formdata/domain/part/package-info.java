/**
 * Multipart body parts exchanged between the builder and the serializer.
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.domain.part;
