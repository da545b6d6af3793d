/**
 * {@link ca.gc.cra.qaops.application.port.MetricsPort} adapters: OpenTelemetry and no-op.
 */
package ca.gc.cra.qaops.infrastructure.metrics;
