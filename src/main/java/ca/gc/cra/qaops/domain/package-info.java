/**
 * Core domain model for alarm classification and statistics.
 * <p><strong>Role:</strong> Immutable value types describing raw chat events, normalized alarms, alarm types,
 * time constraints and analysis results, free of infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain counters feed the {@code analysis.*} metric namespace.</p>
 */
package ca.gc.cra.qaops.domain;
