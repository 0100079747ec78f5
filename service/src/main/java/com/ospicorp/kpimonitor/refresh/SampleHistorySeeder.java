package com.ospicorp.kpimonitor.refresh;

import com.ospicorp.kpimonitor.config.KpiProperties;
import com.ospicorp.kpimonitor.history.KpiRowFactory;
import com.ospicorp.kpimonitor.history.MetricHistoryRepository;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fills an empty store with deterministic sample history so a fresh install has a snapshot.
 */
@Component
public class SampleHistorySeeder implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(SampleHistorySeeder.class);
  static final String SECTION = "sales";
  static final String SOURCE = "sample_seed";
  static final int DAYS = 120;

  private final MetricHistoryRepository historyRepository;
  private final KpiRefreshService refreshService;
  private final KpiProperties properties;
  private final Environment environment;
  private final Clock clock;

  public SampleHistorySeeder(MetricHistoryRepository historyRepository,
      KpiRefreshService refreshService,
      KpiProperties properties,
      Environment environment,
      Clock clock) {
    this.historyRepository = historyRepository;
    this.refreshService = refreshService;
    this.properties = properties;
    this.environment = environment;
    this.clock = clock;
  }

  @Override
  public void run(String... args) {
    if (!properties.getSeed().isEnabled()) {
      log.info("Sample history seeding disabled via property kpi.seed.enabled=false");
      return;
    }
    if (environment.acceptsProfiles(Profiles.of("prod"))) {
      log.info("Skipping sample history seeding because active profile includes prod");
      return;
    }
    int existing = historyRepository.loadAll().size();
    if (existing > 0) {
      log.info("History already contains {} rows; skipping seeding", existing);
      return;
    }
    List<Observation> rows = sampleRows(LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1));
    RefreshSummary summary = refreshService.refresh(rows);
    log.info("Seeded {} sample history rows; snapshot has {} rows", rows.size(),
        summary.snapshotRows());
  }

  List<Observation> sampleRows(LocalDate lastDay) {
    Random random = new Random(8675309L);
    List<Observation> rows = new ArrayList<>(DAYS * 3);
    LocalDate day = lastDay.minusDays(DAYS - 1L);
    for (int i = 0; i < DAYS; i++, day = day.plusDays(1)) {
      double applications = applications(day, random);
      double accepted = Math.round(applications * (0.55 + random.nextGaussian() * 0.03));
      double originated = Math.round(accepted * (0.8 + random.nextGaussian() * 0.02));
      rows.add(row(day, "AcceptCount", "Accepted applications", Math.max(accepted, 0),
          ValueType.COUNT));
      rows.add(row(day, "OriginatedCount", "Originated loans", Math.max(originated, 0),
          ValueType.COUNT));
      if (applications > 0) {
        rows.add(row(day, "AcceptRate", "Acceptance rate", Math.max(accepted, 0) / applications,
            ValueType.RATE));
      }
    }
    return rows;
  }

  // Closed on Sundays, lighter on Saturdays
  private static double applications(LocalDate day, Random random) {
    if (day.getDayOfWeek() == DayOfWeek.SUNDAY) return 0;
    double base = day.getDayOfWeek() == DayOfWeek.SATURDAY ? 80 : 200;
    return Math.max(0, Math.round(base + random.nextGaussian() * base * 0.1));
  }

  private Observation row(LocalDate day, String key, String label, double value, ValueType type) {
    return KpiRowFactory.dailyRow(day, SECTION, key, label, value, type, SOURCE, clock);
  }
}
