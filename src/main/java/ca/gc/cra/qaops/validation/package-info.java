/**
 * Input validation helpers shared by the CLI and configuration layers.
 */
package ca.gc.cra.qaops.validation;
