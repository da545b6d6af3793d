/**
 * Logging helpers: runtime verbosity control and log hygiene for raw alarm text.
 */
package ca.gc.cra.qaops.logging;
