/**
 * <strong>Purpose:</strong> Validation helpers used by the serializer and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No metrics or logging; failures surface as {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters that could inject extra header lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.validation;
