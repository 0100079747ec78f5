package com.ospicorp.kpimonitor.history;

import java.time.YearMonth;
import java.util.List;

/** Monthly partitions for rows that have aged out of the active history. */
public interface HistoryArchive {

  /** Merges rows into the partition, deduplicating with the same last-wins rule as the history. */
  void merge(YearMonth month, List<Observation> rows);

  List<Observation> load(YearMonth month);
}
