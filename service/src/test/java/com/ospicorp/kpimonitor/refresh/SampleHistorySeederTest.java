package com.ospicorp.kpimonitor.refresh;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.kpimonitor.config.KpiProperties;
import com.ospicorp.kpimonitor.history.MetricHistoryStore;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.snapshot.SnapshotBuilder;
import com.ospicorp.kpimonitor.store.CsvMetricHistoryRepository;
import com.ospicorp.kpimonitor.store.CsvSnapshotRepository;
import com.ospicorp.kpimonitor.threshold.ThresholdConfigRegistry;
import com.ospicorp.kpimonitor.threshold.ThresholdEvaluator;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

class SampleHistorySeederTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-02T06:15:00Z"), ZoneOffset.UTC);

  @TempDir
  Path dir;

  private CsvMetricHistoryRepository history;
  private KpiProperties properties;
  private MockEnvironment environment;
  private SampleHistorySeeder seeder;

  @BeforeEach
  void setUp() {
    history = new CsvMetricHistoryRepository(dir.resolve("kpi_history.csv"));
    properties = new KpiProperties();
    properties.getSnapshot().setWindows(List.of(1, 7));
    environment = new MockEnvironment();
    var builder = new SnapshotBuilder(new ThresholdEvaluator(ThresholdConfigRegistry.empty()),
        Runnable::run, CLOCK);
    var refresh = new KpiRefreshService(history,
        new CsvSnapshotRepository(dir.resolve("kpi_serving_metrics.csv")), Optional.empty(),
        new MetricHistoryStore(), builder, properties, CLOCK);
    seeder = new SampleHistorySeeder(history, refresh, properties, environment, CLOCK);
  }

  @Test
  void sampleIsDeterministic() {
    LocalDate last = LocalDate.of(2024, 5, 1);
    assertThat(seeder.sampleRows(last)).isEqualTo(seeder.sampleRows(last));
  }

  @Test
  void sundaysHaveZeroCountsAndNoRate() {
    List<Observation> rows = seeder.sampleRows(LocalDate.of(2024, 5, 1));

    assertThat(rows).filteredOn(o -> o.asOfDate().getDayOfWeek() == DayOfWeek.SUNDAY)
        .isNotEmpty()
        .allSatisfy(o -> {
          assertThat(o.metricKey()).isNotEqualTo("AcceptRate");
          assertThat(o.value()).isZero();
        });
    assertThat(rows).extracting(Observation::asOfDate)
        .contains(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 1, 3))
        .doesNotContain(LocalDate.of(2024, 1, 2));
  }

  @Test
  void seedsEmptyStoreEndingYesterday() {
    seeder.run();

    List<Observation> stored = history.loadAll();
    assertThat(stored).isNotEmpty();
    assertThat(stored).extracting(Observation::asOfDate).contains(LocalDate.of(2024, 5, 1))
        .doesNotContain(LocalDate.of(2024, 5, 2));
    assertThat(stored).extracting(Observation::source).containsOnly("sample_seed");
  }

  @Test
  void skipsWhenHistoryExists() {
    seeder.run();
    int before = history.loadAll().size();
    history.replaceAll(history.loadAll().subList(0, 3));

    seeder.run();

    assertThat(before).isGreaterThan(3);
    assertThat(history.loadAll()).hasSize(3);
  }

  @Test
  void skipsUnderProdProfile() {
    environment.setActiveProfiles("prod");

    seeder.run();

    assertThat(history.loadAll()).isEmpty();
  }

  @Test
  void skipsWhenDisabled() {
    properties.getSeed().setEnabled(false);

    seeder.run();

    assertThat(history.loadAll()).isEmpty();
  }
}
