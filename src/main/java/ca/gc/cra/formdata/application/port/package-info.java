/**
 * <strong>Purpose:</strong> Ports defining the value-inspection and metrics contracts of the encoder.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.application.port;
