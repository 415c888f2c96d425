/**
 * <strong>Purpose:</strong> Configuration records and loaders for the encoder.
 * <p><strong>Concurrency:</strong> Loaders are stateless; records are immutable.
 * <p><strong>Observability:</strong> Validation failures surface as {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.config;
