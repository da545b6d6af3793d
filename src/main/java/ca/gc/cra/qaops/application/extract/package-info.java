/**
 * Alarm extraction from raw events, one strategy per product and environment.
 *
 * <p>The set of strategies is closed: {@link ca.gc.cra.qaops.application.extract.MessageExtractor} is sealed and
 * {@link ca.gc.cra.qaops.application.extract.MessageExtractorRegistry#standard()} holds the lookup table.</p>
 */
package ca.gc.cra.qaops.application.extract;
