/**
 * Metrics adapters implementing {@link ca.gc.cra.formdata.application.port.MetricsPort}.
 * <p><strong>Role:</strong> OpenTelemetry-backed adapter; {@code MetricsPort.NO_OP} covers the disabled case.</p>
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; instruments are cached in concurrent maps.</p>
 * <p><strong>Metrics:</strong> Exposes {@code formdata.encode.*} counters and histograms.</p>
 */
package ca.gc.cra.formdata.infrastructure.metrics;
