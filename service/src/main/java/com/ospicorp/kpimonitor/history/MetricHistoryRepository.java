package com.ospicorp.kpimonitor.history;

import java.util.List;

/** Active history store; failures surface as {@code KpiStoreException}. */
public interface MetricHistoryRepository {

  List<Observation> loadAll();

  void replaceAll(List<Observation> rows);
}
