package ca.gc.cra.qaops.application.analysis;

import ca.gc.cra.qaops.domain.analysis.AnalysisResult;

/**
 * Daily KPI figures for one product and environment.
 *
 * @param totalAlarms alarms matched, ignored ones included
 * @param analyzableAlarms alarms that survived ignore rules
 * @param ignoredAlarms alarms removed by ignore rules
 * @param onCallTotal on-call alarms; {@code null} outside production
 * @param onCallInReperibilita on-call alarms outside business hours; {@code null} outside production
 * @since 0.1.0
 */
public record KpiEntry(
    int totalAlarms,
    int analyzableAlarms,
    int ignoredAlarms,
    Integer onCallTotal,
    Integer onCallInReperibilita) {

  static KpiEntry of(AnalysisResult result, boolean production) {
    return new KpiEntry(
        result.totalAlarms(),
        result.analyzableAlarms(),
        result.ignoredAlarms(),
        production ? result.onCallTotal() : null,
        production ? result.onCallInReperibilita() : null);
  }
}
