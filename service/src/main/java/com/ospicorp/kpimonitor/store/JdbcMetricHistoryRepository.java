package com.ospicorp.kpimonitor.store;

import com.ospicorp.kpimonitor.history.MetricHistoryRepository;
import com.ospicorp.kpimonitor.history.Observation;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

public class JdbcMetricHistoryRepository implements MetricHistoryRepository {
  private final NamedParameterJdbcTemplate jdbc;

  public JdbcMetricHistoryRepository(NamedParameterJdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public List<Observation> loadAll() {
    String sql = """
      SELECT %s
      FROM kpi_history
      ORDER BY as_of_date, section, metric_key, window_days
    """.formatted(JdbcRows.OBSERVATION_COLUMNS);
    try {
      return jdbc.query(sql, JdbcRows.OBSERVATION);
    } catch (DataAccessException ex) {
      throw new KpiStoreException("Failed to read kpi_history", ex);
    }
  }

  @Override
  @Transactional
  public void replaceAll(List<Observation> rows) {
    String insert = "INSERT INTO kpi_history (%s) VALUES (%s)"
        .formatted(JdbcRows.OBSERVATION_COLUMNS, JdbcRows.OBSERVATION_PARAMS);
    try {
      jdbc.getJdbcTemplate().update("DELETE FROM kpi_history");
      if (!rows.isEmpty()) {
        jdbc.batchUpdate(insert, JdbcRows.batch(rows.stream().map(JdbcRows::params).toList()));
      }
    } catch (DataAccessException ex) {
      throw new KpiStoreException("Failed to replace kpi_history", ex);
    }
  }
}
