/**
 * Application layer: the part tree builder, the multipart serializer, and the ports they depend on.
 * <p><strong>Concurrency:</strong> Components hold no mutable state between calls.</p>
 */
package ca.gc.cra.formdata.application;
