package com.ospicorp.kpimonitor.snapshot;

import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.threshold.MetricSeries;
import com.ospicorp.kpimonitor.threshold.ThresholdEvaluator;
import com.ospicorp.kpimonitor.threshold.ThresholdResult;
import com.ospicorp.kpimonitor.threshold.WindowAggregator;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates every (metric, window) pair of the daily history and assembles the serving snapshot.
 */
public class SnapshotBuilder {
  private static final Logger log = LoggerFactory.getLogger(SnapshotBuilder.class);

  static final Comparator<SnapshotRow> ORDER = Comparator.comparing(SnapshotRow::section)
      .thenComparing(SnapshotRow::metricKey)
      .thenComparingInt(SnapshotRow::windowDays);

  private final ThresholdEvaluator evaluator;
  private final Executor executor;
  private final Clock clock;

  public SnapshotBuilder(ThresholdEvaluator evaluator, Executor executor, Clock clock) {
    this.evaluator = evaluator;
    this.executor = executor;
    this.clock = clock;
  }

  public List<SnapshotRow> build(List<Observation> history, Collection<Integer> windows) {
    TreeSet<Integer> distinct = new TreeSet<>();
    for (Integer w : windows) {
      if (w == null || w < 1) {
        log.warn("Ignoring invalid snapshot window {}", w);
      } else {
        distinct.add(w);
      }
    }
    List<MetricSeries> series = MetricSeries.groupDaily(history);
    Instant refreshedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);

    List<CompletableFuture<Optional<SnapshotRow>>> futures = new ArrayList<>();
    for (MetricSeries s : series) {
      for (int w : distinct) {
        futures.add(CompletableFuture.supplyAsync(() -> safeEvaluate(s, w, refreshedAt), executor));
      }
    }

    List<SnapshotRow> rows = new ArrayList<>(futures.size());
    for (CompletableFuture<Optional<SnapshotRow>> f : futures) {
      try {
        f.join().ifPresent(rows::add);
      } catch (CompletionException ex) {
        log.warn("Snapshot evaluation task failed: {}", ex.getMessage(), ex.getCause());
      }
    }
    rows.sort(ORDER);
    log.info("Built snapshot of {} rows from {} metrics x {} windows", rows.size(), series.size(),
        distinct.size());
    return rows;
  }

  /** Single (metric, window) row; empty when the series has no data. */
  public Optional<SnapshotRow> evaluate(MetricSeries series, int windowDays) {
    return evaluate(series, windowDays, clock.instant().truncatedTo(ChronoUnit.SECONDS));
  }

  private Optional<SnapshotRow> safeEvaluate(MetricSeries series, int windowDays,
      Instant refreshedAt) {
    try {
      return evaluate(series, windowDays, refreshedAt);
    } catch (RuntimeException ex) {
      log.warn("Skipping {}/{} window {}: evaluation failed", series.section(), series.metricKey(),
          windowDays, ex);
      return Optional.empty();
    }
  }

  private Optional<SnapshotRow> evaluate(MetricSeries series, int windowDays,
      Instant refreshedAt) {
    OptionalDouble value = WindowAggregator.aggregate(series.points(), windowDays,
        series.valueType());
    if (value.isEmpty()) return Optional.empty();
    ThresholdResult result = evaluator.evaluate(series, windowDays);
    return Optional.of(new SnapshotRow(
        series.latestDate(),
        windowDays,
        series.section(),
        series.metricKey(),
        series.metricLabel(),
        value.getAsDouble(),
        series.valueType(),
        SnapshotRow.SOURCE,
        result.status(),
        result.lowerThreshold(),
        result.upperThreshold(),
        result.pctChange(),
        result.seasonalZscore(),
        result.signalCount(),
        result.signalCodes(),
        result.rollingPointsUsed(),
        result.seasonalPointsUsed(),
        result.weekdayFilterApplied(),
        refreshedAt));
  }
}
