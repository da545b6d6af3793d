/**
 * Alarm records and alarm type classification.
 */
package ca.gc.cra.qaops.domain.alarm;
