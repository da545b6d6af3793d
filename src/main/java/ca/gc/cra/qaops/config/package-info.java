/**
 * Analyzer configuration: YAML loading, immutable configuration records and validation.
 */
package ca.gc.cra.qaops.config;
