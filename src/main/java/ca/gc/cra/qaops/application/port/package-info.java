/**
 * Ports implemented by infrastructure adapters (event sources, metrics).
 */
package ca.gc.cra.qaops.application.port;
