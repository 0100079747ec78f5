package com.ospicorp.kpimonitor.refresh;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.kpimonitor.config.KpiProperties;
import com.ospicorp.kpimonitor.history.HistoryArchive;
import com.ospicorp.kpimonitor.history.KpiRowFactory;
import com.ospicorp.kpimonitor.history.MetricHistoryStore;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import com.ospicorp.kpimonitor.snapshot.SnapshotBuilder;
import com.ospicorp.kpimonitor.store.CsvHistoryArchive;
import com.ospicorp.kpimonitor.store.CsvMetricHistoryRepository;
import com.ospicorp.kpimonitor.store.CsvSnapshotRepository;
import com.ospicorp.kpimonitor.threshold.ThresholdConfigRegistry;
import com.ospicorp.kpimonitor.threshold.ThresholdEvaluator;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KpiRefreshServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-02T06:15:00Z"), ZoneOffset.UTC);

  @TempDir
  Path dir;

  private CsvMetricHistoryRepository history;
  private CsvSnapshotRepository snapshot;
  private KpiProperties properties;

  @BeforeEach
  void setUp() {
    history = new CsvMetricHistoryRepository(dir.resolve("kpi_history.csv"));
    snapshot = new CsvSnapshotRepository(dir.resolve("kpi_serving_metrics.csv"));
    properties = new KpiProperties();
    properties.getSnapshot().setWindows(List.of(1, 7));
  }

  private KpiRefreshService service(HistoryArchive archive) {
    var builder = new SnapshotBuilder(new ThresholdEvaluator(ThresholdConfigRegistry.empty()),
        Runnable::run, CLOCK);
    return new KpiRefreshService(history, snapshot, Optional.ofNullable(archive),
        new MetricHistoryStore(), builder, properties, CLOCK);
  }

  private static List<Observation> days(LocalDate last, int count, String metric) {
    List<Observation> rows = new ArrayList<>();
    for (int i = count - 1; i >= 0; i--) {
      rows.add(KpiRowFactory.dailyRow(last.minusDays(i), "sales", metric, null, 10 + i,
          ValueType.COUNT, null, CLOCK));
    }
    return rows;
  }

  @Test
  void refreshPersistsHistoryAndSnapshot() {
    var summary = service(null).refresh(days(LocalDate.of(2024, 5, 1), 10, "AcceptCount"));

    assertThat(summary.rowsReceived()).isEqualTo(10);
    assertThat(summary.historyRows()).isEqualTo(10);
    assertThat(summary.archivedRows()).isZero();
    assertThat(summary.snapshotRows()).isEqualTo(2);
    assertThat(summary.latestDate()).isEqualTo(LocalDate.of(2024, 5, 1));
    assertThat(history.loadAll()).hasSize(10);
    assertThat(snapshot.load()).hasSize(2);
  }

  @Test
  void emptyRefreshKeepsStoredHistory() {
    var svc = service(null);
    svc.refresh(days(LocalDate.of(2024, 5, 1), 10, "AcceptCount"));

    var summary = svc.rebuild();

    assertThat(summary.rowsReceived()).isZero();
    assertThat(summary.historyRows()).isEqualTo(10);
    assertThat(history.loadAll()).hasSize(10);
    assertThat(snapshot.load()).hasSize(2);
  }

  @Test
  void newRowsReplaceEarlierValuesForSameDay() {
    var svc = service(null);
    svc.refresh(days(LocalDate.of(2024, 5, 1), 3, "AcceptCount"));
    var correction = KpiRowFactory.dailyRow(LocalDate.of(2024, 5, 1), "sales", "AcceptCount",
        null, 99, ValueType.COUNT, null, CLOCK);

    svc.refresh(List.of(correction));

    assertThat(history.loadAll()).hasSize(3)
        .filteredOn(o -> o.asOfDate().equals(LocalDate.of(2024, 5, 1)))
        .extracting(Observation::value)
        .containsExactly(99d);
  }

  @Test
  void expiredRowsMoveToArchive() {
    properties.getHistory().setRetentionDays(30);
    var archive = new CsvHistoryArchive(dir.resolve("archive"));

    var summary = service(archive).refresh(days(LocalDate.of(2024, 5, 1), 40, "AcceptCount"));

    assertThat(summary.historyRows()).isEqualTo(30);
    assertThat(summary.archivedRows()).isEqualTo(10);
    assertThat(dir.resolve("archive/kpi_history_2024_03.csv")).exists();
    assertThat(dir.resolve("archive/kpi_history_2024_04.csv")).exists();
  }

  @Test
  void undatedRowsAreNotReportedAsArchived() {
    properties.getHistory().setRetentionDays(30);
    var archive = new CsvHistoryArchive(dir.resolve("archive"));
    List<Observation> rows = new ArrayList<>(days(LocalDate.of(2024, 5, 1), 40, "AcceptCount"));
    rows.add(new Observation(null, 1, "sales", "AcceptCount", "AcceptCount", 5, ValueType.COUNT,
        "test", CLOCK.instant()));

    var summary = service(archive).refresh(rows);

    assertThat(summary.rowsReceived()).isEqualTo(41);
    assertThat(summary.historyRows()).isEqualTo(30);
    assertThat(summary.archivedRows()).isEqualTo(10);
  }
}
