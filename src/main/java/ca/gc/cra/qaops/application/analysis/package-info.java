/**
 * Per alarm type analysis, result merging and the analysis and KPI use cases.
 */
package ca.gc.cra.qaops.application.analysis;
