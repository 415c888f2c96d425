/**
 * Growable byte sinks for multipart output.
 * <p><strong>Role:</strong> Infrastructure adapter receiving serializer output incrementally.</p>
 * <p><strong>Concurrency:</strong> Buffers are single-owner; callers must not share them across threads.</p>
 * <p><strong>Security:</strong> Buffers may hold uploaded file content; callers should {@code clear()} before
 * reuse.</p>
 */
package ca.gc.cra.formdata.infrastructure.buffer;
