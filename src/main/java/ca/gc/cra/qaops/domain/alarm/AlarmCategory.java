package ca.gc.cra.qaops.domain.alarm;

/**
 * Alarm type category. {@link #ONCALL} alarms are attributed to the calendar day and tracked for
 * out-of-hours handling; {@link #NORMAL} alarms are attributed to the evening-to-evening shift day.
 *
 * @since 0.1.0
 */
public enum AlarmCategory {
  NORMAL,
  ONCALL
}
