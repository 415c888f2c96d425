/**
 * Infrastructure adapters: value introspection, output buffers, multipart framing, and metrics backends.
 * <p><strong>Role:</strong> Adapter layer implementing application ports with third-party libraries.</p>
 * <p><strong>Concurrency:</strong> Adapters are thread-safe unless documented otherwise.</p>
 */
package ca.gc.cra.formdata.infrastructure;
