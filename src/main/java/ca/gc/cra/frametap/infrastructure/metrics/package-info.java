/**
 * OpenTelemetry-backed {@link ca.gc.cra.frametap.application.port.MetricsPort}. Export is disabled unless
 * {@code metricsExporter=otlp} is set.
 */
package ca.gc.cra.frametap.infrastructure.metrics;
