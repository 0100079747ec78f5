package com.ospicorp.kpimonitor.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import com.ospicorp.kpimonitor.threshold.AlertStatus;
import com.ospicorp.kpimonitor.threshold.Direction;
import com.ospicorp.kpimonitor.threshold.MetricSeries;
import com.ospicorp.kpimonitor.threshold.StaticThresholds;
import com.ospicorp.kpimonitor.threshold.ThresholdConfigRegistry;
import com.ospicorp.kpimonitor.threshold.ThresholdEvaluator;
import com.ospicorp.kpimonitor.threshold.ThresholdResult;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class SnapshotBuilderTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-02T06:15:30.500Z"), ZoneOffset.UTC);
  private static final LocalDate LAST = LocalDate.of(2024, 5, 1);

  private static List<Observation> history(String section, String metric, ValueType type,
      int days, double value) {
    List<Observation> rows = new ArrayList<>();
    for (int i = days - 1; i >= 0; i--) {
      rows.add(new Observation(LAST.minusDays(i), 1, section, metric, metric + " label", value,
          type, "test", null));
    }
    return rows;
  }

  private static ThresholdEvaluator evaluator() {
    return new ThresholdEvaluator(new ThresholdConfigRegistry(Map.of(
        "AcceptCount", new StaticThresholds(Direction.LOWER_ONLY, 50d, null, null))));
  }

  @Test
  void buildsOneSortedRowPerMetricAndDistinctWindow() {
    List<Observation> rows = new ArrayList<>(history("sales", "OriginatedCount", ValueType.COUNT, 10, 5));
    rows.addAll(history("sales", "AcceptCount", ValueType.COUNT, 10, 10));
    rows.addAll(history("risk", "AcceptRate", ValueType.RATE, 10, 0.5));
    var builder = new SnapshotBuilder(evaluator(), Runnable::run, CLOCK);

    var snapshot = builder.build(rows, Arrays.asList(7, 1, 7, 0, null));

    assertThat(snapshot).extracting(SnapshotRow::section, SnapshotRow::metricKey,
        SnapshotRow::windowDays).containsExactly(
        tuple("risk", "AcceptRate", 1),
        tuple("risk", "AcceptRate", 7),
        tuple("sales", "AcceptCount", 1),
        tuple("sales", "AcceptCount", 7),
        tuple("sales", "OriginatedCount", 1),
        tuple("sales", "OriginatedCount", 7));
    assertThat(snapshot).allSatisfy(row -> {
      assertThat(row.asOfDate()).isEqualTo(LAST);
      assertThat(row.source()).isEqualTo(SnapshotRow.SOURCE);
      assertThat(row.refreshedAt()).isEqualTo(Instant.parse("2024-05-02T06:15:30Z"));
    });
  }

  @Test
  void rowsCarryAggregateAndEvaluation() {
    var builder = new SnapshotBuilder(evaluator(), Runnable::run, CLOCK);

    var snapshot = builder.build(history("sales", "AcceptCount", ValueType.COUNT, 10, 10),
        List.of(1, 7));

    SnapshotRow daily = snapshot.get(0);
    assertThat(daily.value()).isEqualTo(10d);
    assertThat(daily.status()).isEqualTo(AlertStatus.RED);
    assertThat(daily.signals()).isEqualTo("L");
    assertThat(daily.signalCount()).isEqualTo(1);
    assertThat(daily.metricLabel()).isEqualTo("AcceptCount label");
    SnapshotRow weekly = snapshot.get(1);
    assertThat(weekly.value()).isEqualTo(70d);
    assertThat(weekly.status()).isEqualTo(AlertStatus.GREEN);
    assertThat(weekly.signals()).isEmpty();
  }

  @Test
  void nonDailyRowsAreIgnored() {
    var weeklyOnly = List.of(new Observation(LAST, 7, "sales", "Weekly", "Weekly", 70,
        ValueType.COUNT, "test", null));
    var builder = new SnapshotBuilder(evaluator(), Runnable::run, CLOCK);

    assertThat(builder.build(weeklyOnly, List.of(1, 7))).isEmpty();
  }

  @Test
  void failingMetricIsSkippedAndOthersAreKept() {
    ThresholdEvaluator flaky = new ThresholdEvaluator(ThresholdConfigRegistry.empty()) {
      @Override
      public ThresholdResult evaluate(MetricSeries series, int windowDays) {
        if (series.metricKey().equals("Broken")) {
          throw new IllegalStateException("boom");
        }
        return super.evaluate(series, windowDays);
      }
    };
    List<Observation> rows = new ArrayList<>(history("sales", "Broken", ValueType.COUNT, 3, 1));
    rows.addAll(history("sales", "Healthy", ValueType.COUNT, 3, 1));
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      var snapshot = new SnapshotBuilder(flaky, pool, CLOCK).build(rows, List.of(1, 7));

      assertThat(snapshot).extracting(SnapshotRow::metricKey).containsOnly("Healthy");
      assertThat(snapshot).hasSize(2);
    } finally {
      pool.shutdownNow();
    }
  }
}
