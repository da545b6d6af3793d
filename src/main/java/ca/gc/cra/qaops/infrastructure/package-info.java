/**
 * Adapters implementing the application ports: event archives and OpenTelemetry metrics.
 */
package ca.gc.cra.qaops.infrastructure;
