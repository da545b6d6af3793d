/**
 * Analysis outcomes: per alarm type results, merged results and ignored message details.
 */
package ca.gc.cra.qaops.domain.analysis;
