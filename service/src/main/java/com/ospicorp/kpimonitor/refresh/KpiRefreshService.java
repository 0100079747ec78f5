package com.ospicorp.kpimonitor.refresh;

import com.ospicorp.kpimonitor.config.KpiProperties;
import com.ospicorp.kpimonitor.history.HistoryArchive;
import com.ospicorp.kpimonitor.history.MetricHistoryRepository;
import com.ospicorp.kpimonitor.history.MetricHistoryStore;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.snapshot.SnapshotBuilder;
import com.ospicorp.kpimonitor.snapshot.SnapshotRepository;
import com.ospicorp.kpimonitor.snapshot.SnapshotRow;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one refresh: merge new rows into the history, age out old rows, persist, and rebuild the
 * serving snapshot. Runs are serialized within the process.
 */
@Service
public class KpiRefreshService {
  private static final Logger log = LoggerFactory.getLogger(KpiRefreshService.class);

  private final MetricHistoryRepository historyRepository;
  private final SnapshotRepository snapshotRepository;
  private final HistoryArchive archive;
  private final MetricHistoryStore store;
  private final SnapshotBuilder snapshotBuilder;
  private final KpiProperties properties;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  public KpiRefreshService(MetricHistoryRepository historyRepository,
      SnapshotRepository snapshotRepository,
      Optional<HistoryArchive> archive,
      MetricHistoryStore store,
      SnapshotBuilder snapshotBuilder,
      KpiProperties properties,
      Clock clock) {
    this.historyRepository = historyRepository;
    this.snapshotRepository = snapshotRepository;
    this.archive = archive.orElse(null);
    this.store = store;
    this.snapshotBuilder = snapshotBuilder;
    this.properties = properties;
    this.clock = clock;
  }

  public RefreshSummary refresh(List<Observation> newRows) {
    List<Observation> incoming = newRows == null ? List.of() : newRows;
    lock.lock();
    try {
      List<Observation> existing = historyRepository.loadAll();
      List<Observation> merged = store.append(existing, incoming);
      if (merged.isEmpty()) {
        log.info("No new rows received; keeping {} stored history rows", existing.size());
        merged = MetricHistoryStore.merge(existing);
      }
      MetricHistoryStore.Retention retention = store.retain(merged,
          properties.getHistory().getRetentionDays(), archive);
      List<Observation> kept = retention.kept();
      historyRepository.replaceAll(kept);

      List<SnapshotRow> snapshot = snapshotBuilder.build(kept,
          properties.getSnapshot().getWindows());
      snapshotRepository.replace(snapshot);

      RefreshSummary summary = new RefreshSummary(incoming.size(), kept.size(),
          retention.expired(), snapshot.size(), latestDate(kept),
          clock.instant().truncatedTo(ChronoUnit.SECONDS));
      log.info("Refresh complete: received={} history={} archived={} snapshot={} latest={}",
          summary.rowsReceived(), summary.historyRows(), summary.archivedRows(),
          summary.snapshotRows(), summary.latestDate());
      return summary;
    } finally {
      lock.unlock();
    }
  }

  /** Rebuilds the snapshot from the stored history without adding rows. */
  public RefreshSummary rebuild() {
    return refresh(List.of());
  }

  private static LocalDate latestDate(List<Observation> rows) {
    return rows.stream()
        .map(Observation::asOfDate)
        .filter(Objects::nonNull)
        .max(Comparator.naturalOrder())
        .orElse(null);
  }
}
