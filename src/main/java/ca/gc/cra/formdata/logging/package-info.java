/**
 * <strong>Purpose:</strong> Logging utilities that bound user-derived text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Used with SLF4J; no custom metrics.
 * <p><strong>Security:</strong> Part bodies are never logged; only truncated part names.
 *
 * @since 0.1.0
 */
package ca.gc.cra.formdata.logging;
