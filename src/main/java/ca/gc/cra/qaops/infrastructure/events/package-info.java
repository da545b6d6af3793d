/**
 * Offline event sources reading exported channel history.
 */
package ca.gc.cra.qaops.infrastructure.events;
