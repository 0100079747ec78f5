package com.ospicorp.kpimonitor.store;

import com.ospicorp.kpimonitor.history.MetricHistoryRepository;
import com.ospicorp.kpimonitor.history.Observation;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CsvMetricHistoryRepository implements MetricHistoryRepository {
  private static final Logger log = LoggerFactory.getLogger(CsvMetricHistoryRepository.class);

  private final Path file;

  public CsvMetricHistoryRepository(Path file) {
    this.file = file;
  }

  @Override
  public List<Observation> loadAll() {
    try {
      return decode(CsvFiles.read(file, ObservationRecord.class), file);
    } catch (IOException ex) {
      throw new KpiStoreException("Failed to read history from " + file, ex);
    }
  }

  @Override
  public void replaceAll(List<Observation> rows) {
    try {
      CsvFiles.write(file, Observation.class, rows);
      log.debug("Wrote {} history rows to {}", rows.size(), file);
    } catch (IOException ex) {
      throw new KpiStoreException("Failed to write history to " + file, ex);
    }
  }

  static List<Observation> decode(List<ObservationRecord> records, Path origin) {
    List<Observation> rows = records.stream()
        .map(ObservationRecord::toObservation)
        .flatMap(Optional::stream)
        .toList();
    if (rows.size() < records.size()) {
      log.warn("Dropped {} malformed rows while reading {}", records.size() - rows.size(), origin);
    }
    return rows;
  }
}
