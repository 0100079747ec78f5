package com.ospicorp.kpimonitor.snapshot;

import com.ospicorp.kpimonitor.history.MetricHistoryRepository;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.threshold.AlertStatus;
import com.ospicorp.kpimonitor.threshold.MetricSeries;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Read side of the API: filtered snapshot rows, one metric's daily history, and on-demand
 * evaluation of a single window.
 */
@Service
public class KpiQueryService {
  private final SnapshotRepository snapshotRepository;
  private final MetricHistoryRepository historyRepository;
  private final SnapshotBuilder snapshotBuilder;

  public KpiQueryService(SnapshotRepository snapshotRepository,
      MetricHistoryRepository historyRepository, SnapshotBuilder snapshotBuilder) {
    this.snapshotRepository = snapshotRepository;
    this.historyRepository = historyRepository;
    this.snapshotBuilder = snapshotBuilder;
  }

  public List<SnapshotRow> snapshot(String section, String metricKey, AlertStatus status) {
    return snapshotRepository.load().stream()
        .filter(r -> section == null || r.section().equalsIgnoreCase(section))
        .filter(r -> metricKey == null || r.metricKey().equalsIgnoreCase(metricKey))
        .filter(r -> status == null || r.status() == status)
        .sorted(SnapshotBuilder.ORDER)
        .toList();
  }

  // Exact (section, metric key) match wins; otherwise the first case-insensitive match is used
  public MetricSeries series(String section, String metricKey) {
    List<Observation> history = historyRepository.loadAll();
    Optional<Observation> anchor = history.stream()
        .filter(o -> o.section().equals(section) && o.metricKey().equals(metricKey))
        .findFirst()
        .or(() -> history.stream()
            .filter(o -> o.section().equalsIgnoreCase(section))
            .filter(o -> o.metricKey().equalsIgnoreCase(metricKey))
            .findFirst());
    MetricSeries series = anchor.map(a -> MetricSeries.from(a.section(), a.metricKey(),
            history.stream()
                .filter(o -> o.section().equals(a.section()))
                .filter(o -> o.metricKey().equals(a.metricKey()))
                .toList()))
        .orElse(null);
    if (series == null || series.isEmpty()) {
      throw new NoSuchElementException("No daily history for metric " + section + "/" + metricKey);
    }
    return series;
  }

  public MetricSeries history(String section, String metricKey, LocalDate start, LocalDate end) {
    MetricSeries series = series(section, metricKey);
    return new MetricSeries(series.section(), series.metricKey(), series.metricLabel(),
        series.valueType(), series.points().stream()
            .filter(p -> start == null || !p.date().isBefore(start))
            .filter(p -> end == null || !p.date().isAfter(end))
            .toList());
  }

  public SnapshotRow evaluate(String section, String metricKey, int windowDays) {
    MetricSeries series = series(section, metricKey);
    return snapshotBuilder.evaluate(series, windowDays)
        .orElseThrow(() -> new NoSuchElementException(
            "No data to evaluate for metric " + section + "/" + metricKey));
  }
}
