package com.ospicorp.kpimonitor.snapshot;

import java.util.List;

public interface SnapshotRepository {

  /** Replaces the whole serving snapshot. */
  void replace(List<SnapshotRow> rows);

  List<SnapshotRow> load();
}
