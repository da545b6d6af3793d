/**
 * Application layer: alarm extraction, ignore rules, classification and the analysis use case.
 *
 * <p>Everything here is synchronous and free of I/O except through the ports in
 * {@link ca.gc.cra.qaops.application.port}.</p>
 */
package ca.gc.cra.qaops.application;
