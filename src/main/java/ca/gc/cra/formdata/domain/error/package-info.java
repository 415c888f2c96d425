/**
 * Failure taxonomy for form-data encoding.
 * <p><strong>Role:</strong> Domain exceptions propagated unchanged to callers of the encoder facade.</p>
 * <p><strong>Observability:</strong> Reasons double as metric and log tags.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.domain.error;
