package com.ospicorp.kpimonitor.store;

import com.ospicorp.kpimonitor.snapshot.SnapshotRepository;
import com.ospicorp.kpimonitor.snapshot.SnapshotRow;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public class CsvSnapshotRepository implements SnapshotRepository {
  private final Path file;

  public CsvSnapshotRepository(Path file) {
    this.file = file;
  }

  @Override
  public void replace(List<SnapshotRow> rows) {
    try {
      CsvFiles.write(file, SnapshotRow.class, rows);
    } catch (IOException ex) {
      throw new KpiStoreException("Failed to write snapshot to " + file, ex);
    }
  }

  @Override
  public List<SnapshotRow> load() {
    try {
      return CsvFiles.read(file, SnapshotRow.class);
    } catch (IOException ex) {
      throw new KpiStoreException("Failed to read snapshot from " + file, ex);
    }
  }
}
