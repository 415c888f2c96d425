/**
 * RFC 2388 {@code multipart/form-data} wire encoding.
 * <p><strong>Role:</strong> Infrastructure codec turning named parts into framed bytes for byte arrays, strings,
 * growable buffers, and output streams.</p>
 * <p><strong>Concurrency:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Security:</strong> Rejects CR/LF in header parameters and bodies containing the delimiter so part
 * content cannot forge extra parts.</p>
 */
package ca.gc.cra.formdata.infrastructure.protocol.multipart;
