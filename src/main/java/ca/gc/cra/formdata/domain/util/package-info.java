/**
 * <strong>Purpose:</strong> Byte and text helpers shared by the encoder.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> None; callers decide what to log.
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.domain.util;
