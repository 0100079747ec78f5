package com.ospicorp.kpimonitor.threshold;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily-grain series of one (section, metric key), ascending by date without duplicate dates.
 * Label and value type are taken from the latest observation.
 */
public record MetricSeries(
    @JsonProperty("section") String section,
    @JsonProperty("metric_key") String metricKey,
    @JsonProperty("metric_label") String metricLabel,
    @JsonProperty("value_type") ValueType valueType,
    @JsonProperty("points") List<DataPoint> points
) {

  public MetricSeries {
    points = List.copyOf(points);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return points.isEmpty();
  }

  @JsonIgnore
  public LocalDate latestDate() {
    return points.isEmpty() ? null : points.get(points.size() - 1).date();
  }

  /** Builds the series of one metric; non-daily rows are ignored and later rows win per date. */
  public static MetricSeries from(String section, String metricKey, List<Observation> rows) {
    TreeMap<LocalDate, Observation> byDate = new TreeMap<>();
    for (Observation o : rows) {
      if (o.isDaily() && o.asOfDate() != null) {
        byDate.put(o.asOfDate(), o);
      }
    }
    List<DataPoint> points = new ArrayList<>(byDate.size());
    byDate.values().forEach(o -> points.add(new DataPoint(o.asOfDate(), o.value())));
    if (byDate.isEmpty()) {
      return new MetricSeries(section, metricKey, metricKey, ValueType.COUNT, points);
    }
    Observation latest = byDate.lastEntry().getValue();
    String label = latest.metricLabel() == null || latest.metricLabel().isBlank()
        ? metricKey : latest.metricLabel();
    return new MetricSeries(section, metricKey, label, latest.valueType(), points);
  }

  /** Groups daily-grain history into one series per (section, metric key), sorted by both. */
  public static List<MetricSeries> groupDaily(List<Observation> history) {
    Map<List<String>, List<Observation>> groups = new LinkedHashMap<>();
    for (Observation o : history) {
      if (!o.isDaily()) continue;
      groups.computeIfAbsent(List.of(o.section(), o.metricKey()), k -> new ArrayList<>()).add(o);
    }
    List<MetricSeries> out = new ArrayList<>(groups.size());
    groups.forEach((key, rows) -> {
      MetricSeries series = from(key.get(0), key.get(1), rows);
      if (!series.isEmpty()) out.add(series);
    });
    out.sort(Comparator.comparing(MetricSeries::section).thenComparing(MetricSeries::metricKey));
    return out;
  }
}
