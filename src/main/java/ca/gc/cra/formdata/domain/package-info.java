/**
 * Core domain model for turning structured values into multipart form data.
 * <p><strong>Role:</strong> Domain layer types describing values, part trees, parts, and failures without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Payload-bearing types copy defensively at construction and expose read-only
 * views for serialization.</p>
 * <p><strong>Security:</strong> Part bodies may carry user uploads; log part names only, never bodies.</p>
 */
package ca.gc.cra.formdata.domain;
