package com.ospicorp.kpimonitor.config;

import com.ospicorp.kpimonitor.history.MetricHistoryStore;
import com.ospicorp.kpimonitor.snapshot.SnapshotBuilder;
import com.ospicorp.kpimonitor.threshold.ThresholdConfigRegistry;
import com.ospicorp.kpimonitor.threshold.ThresholdEvaluator;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KpiMonitorConfig {

  @Bean
  ThresholdConfigRegistry thresholdConfigRegistry(KpiProperties properties) {
    return ThresholdConfigFactory.registry(properties.getAlerts());
  }

  @Bean
  ThresholdEvaluator thresholdEvaluator(ThresholdConfigRegistry registry) {
    return new ThresholdEvaluator(registry);
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdown")
  ExecutorService snapshotExecutor(KpiProperties properties) {
    int configured = properties.getSnapshot().getParallelism();
    int threads = configured > 0 ? configured : Runtime.getRuntime().availableProcessors();
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory = r -> {
      Thread t = new Thread(r, "snapshot-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return Executors.newFixedThreadPool(threads, factory);
  }

  @Bean
  SnapshotBuilder snapshotBuilder(ThresholdEvaluator evaluator,
      @Qualifier("snapshotExecutor") ExecutorService executor, Clock clock) {
    return new SnapshotBuilder(evaluator, executor, clock);
  }

  @Bean
  MetricHistoryStore metricHistoryStore() {
    return new MetricHistoryStore();
  }
}
