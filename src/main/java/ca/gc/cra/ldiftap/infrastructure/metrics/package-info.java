/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.ldiftap.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> OpenTelemetry OTLP export, degrading to a no-op meter; configured via {@code otel.*} system
 * properties set by the CLI.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ldiftap.infrastructure.metrics;
