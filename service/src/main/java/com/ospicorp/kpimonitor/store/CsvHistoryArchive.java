package com.ospicorp.kpimonitor.store;

import com.ospicorp.kpimonitor.history.HistoryArchive;
import com.ospicorp.kpimonitor.history.MetricHistoryStore;
import com.ospicorp.kpimonitor.history.Observation;
import java.io.IOException;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/** One {@code kpi_history_YYYY_MM.csv} file per calendar month. */
public class CsvHistoryArchive implements HistoryArchive {
  private final Path directory;

  public CsvHistoryArchive(Path directory) {
    this.directory = directory;
  }

  @Override
  public synchronized void merge(YearMonth month, List<Observation> rows) {
    if (rows.isEmpty()) return;
    Path file = fileFor(month);
    try {
      List<Observation> all = new ArrayList<>(load(month));
      all.addAll(rows);
      CsvFiles.write(file, Observation.class, MetricHistoryStore.merge(all));
    } catch (IOException ex) {
      throw new KpiStoreException("Failed to update archive " + file, ex);
    }
  }

  @Override
  public List<Observation> load(YearMonth month) {
    Path file = fileFor(month);
    try {
      return CsvMetricHistoryRepository.decode(CsvFiles.read(file, ObservationRecord.class), file);
    } catch (IOException ex) {
      throw new KpiStoreException("Failed to read archive " + file, ex);
    }
  }

  Path fileFor(YearMonth month) {
    return directory.resolve(String.format("kpi_history_%04d_%02d.csv", month.getYear(),
        month.getMonthValue()));
  }
}
