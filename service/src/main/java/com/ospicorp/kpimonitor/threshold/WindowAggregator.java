package com.ospicorp.kpimonitor.threshold;

import com.ospicorp.kpimonitor.history.ValueType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Rolls an ascending daily series into calendar-day windows: sums for counts (missing days
 * count as zero), means of the present observations for rates.
 */
public final class WindowAggregator {
  private WindowAggregator() {
  }

  /** Aggregate of the window ending at the latest date, or empty when there are no points. */
  public static OptionalDouble aggregate(List<DataPoint> daily, int windowDays, ValueType type) {
    List<DataPoint> rolled = rolling(daily, windowDays, type);
    if (rolled.isEmpty()) return OptionalDouble.empty();
    return OptionalDouble.of(rolled.get(rolled.size() - 1).value());
  }

  /** One aggregate per input date, each over the window ending at that date. */
  public static List<DataPoint> rolling(List<DataPoint> daily, int windowDays, ValueType type) {
    if (windowDays < 1) {
      throw new IllegalArgumentException("windowDays must be at least 1, was " + windowDays);
    }
    List<DataPoint> out = new ArrayList<>(daily.size());
    int start = 0;
    for (int i = 0; i < daily.size(); ++i) {
      LocalDate end = daily.get(i).date();
      LocalDate first = end.minusDays(windowDays - 1L);
      while (daily.get(start).date().isBefore(first)) {
        ++start;
      }
      double sum = 0.0;
      for (int j = start; j <= i; ++j) {
        sum += daily.get(j).value();
      }
      double value = type == ValueType.COUNT ? sum : sum / (i - start + 1);
      out.add(new DataPoint(end, value));
    }
    return out;
  }
}
