package com.ospicorp.kpimonitor.config;

import com.ospicorp.kpimonitor.history.HistoryArchive;
import com.ospicorp.kpimonitor.history.MetricHistoryRepository;
import com.ospicorp.kpimonitor.snapshot.SnapshotRepository;
import com.ospicorp.kpimonitor.store.CsvHistoryArchive;
import com.ospicorp.kpimonitor.store.CsvMetricHistoryRepository;
import com.ospicorp.kpimonitor.store.CsvSnapshotRepository;
import com.ospicorp.kpimonitor.store.JdbcHistoryArchive;
import com.ospicorp.kpimonitor.store.JdbcMetricHistoryRepository;
import com.ospicorp.kpimonitor.store.JdbcSnapshotRepository;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Selects the persistence adapters with {@code kpi.store.type}.
 */
@Configuration
public class StoreConfig {
  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Configuration
  @ConditionalOnProperty(name = "kpi.store.type", havingValue = "csv", matchIfMissing = true)
  static class CsvStores {

    @Bean
    MetricHistoryRepository metricHistoryRepository(KpiProperties properties) {
      Path path = Path.of(properties.getHistory().getPath());
      log.info("Using CSV history store at {}", path.toAbsolutePath());
      return new CsvMetricHistoryRepository(path);
    }

    @Bean
    @ConditionalOnProperty(name = "kpi.history.archive-enabled", havingValue = "true",
        matchIfMissing = true)
    HistoryArchive historyArchive(KpiProperties properties) {
      return new CsvHistoryArchive(Path.of(properties.getHistory().getArchiveDir()));
    }

    @Bean
    SnapshotRepository snapshotRepository(KpiProperties properties) {
      return new CsvSnapshotRepository(Path.of(properties.getSnapshot().getPath()));
    }
  }

  @Configuration
  @ConditionalOnProperty(name = "kpi.store.type", havingValue = "jdbc")
  static class JdbcStores {

    @Bean
    MetricHistoryRepository metricHistoryRepository(NamedParameterJdbcTemplate jdbc) {
      log.info("Using JDBC history store");
      return new JdbcMetricHistoryRepository(jdbc);
    }

    @Bean
    @ConditionalOnProperty(name = "kpi.history.archive-enabled", havingValue = "true",
        matchIfMissing = true)
    HistoryArchive historyArchive(NamedParameterJdbcTemplate jdbc) {
      return new JdbcHistoryArchive(jdbc);
    }

    @Bean
    SnapshotRepository snapshotRepository(NamedParameterJdbcTemplate jdbc) {
      return new JdbcSnapshotRepository(jdbc);
    }
  }
}
