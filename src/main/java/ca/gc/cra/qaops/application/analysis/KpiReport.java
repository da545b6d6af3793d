package ca.gc.cra.qaops.application.analysis;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * KPI figures collected for every product, environment and day, in collection order.
 *
 * @param rows one row per product, environment and day
 * @since 0.1.0
 */
public record KpiReport(List<Row> rows) {

  public KpiReport {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  /**
   * Figures of one day; {@code entry} is {@code null} when the day could not be collected.
   *
   * @param product product name
   * @param environment environment name
   * @param date analyzed day
   * @param entry figures, or {@code null} on failure
   * @param failure failure description, or {@code null} on success
   */
  public record Row(String product, String environment, LocalDate date, KpiEntry entry, String failure) {
    public Row {
      Objects.requireNonNull(product, "product");
      Objects.requireNonNull(environment, "environment");
      Objects.requireNonNull(date, "date");
      if ((entry == null) == (failure == null)) {
        throw new IllegalArgumentException("row must carry either an entry or a failure");
      }
    }

    public boolean failed() {
      return entry == null;
    }
  }

  /**
   * @return figures for the given key, empty when absent or failed
   */
  public Optional<KpiEntry> entry(String product, String environment, LocalDate date) {
    return rows.stream()
        .filter(row -> row.product().equals(product)
            && row.environment().equals(environment)
            && row.date().equals(date))
        .findFirst()
        .map(Row::entry);
  }

  public List<Row> failures() {
    return rows.stream().filter(Row::failed).toList();
  }
}
