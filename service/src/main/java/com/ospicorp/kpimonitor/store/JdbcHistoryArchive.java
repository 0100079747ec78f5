package com.ospicorp.kpimonitor.store;

import com.ospicorp.kpimonitor.history.HistoryArchive;
import com.ospicorp.kpimonitor.history.MetricHistoryStore;
import com.ospicorp.kpimonitor.history.Observation;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

/** Archive rows live in one table, partitioned logically by a {@code YYYY-MM} column. */
public class JdbcHistoryArchive implements HistoryArchive {
  private final NamedParameterJdbcTemplate jdbc;

  public JdbcHistoryArchive(NamedParameterJdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  @Transactional
  public void merge(YearMonth month, List<Observation> rows) {
    if (rows.isEmpty()) return;
    String sql = """
      INSERT INTO kpi_history_archive (year_month, %s)
      VALUES (:year_month, %s)
      ON CONFLICT (year_month, as_of_date, window_days, section, metric_key) DO UPDATE SET
        metric_label = EXCLUDED.metric_label,
        value = EXCLUDED.value,
        value_type = EXCLUDED.value_type,
        source = EXCLUDED.source,
        refreshed_at = EXCLUDED.refreshed_at
    """.formatted(JdbcRows.OBSERVATION_COLUMNS, JdbcRows.OBSERVATION_PARAMS);
    var params = MetricHistoryStore.merge(rows).stream()
        .map(o -> JdbcRows.params(o).addValue("year_month", month.toString()))
        .toList();
    try {
      jdbc.batchUpdate(sql, JdbcRows.batch(params));
    } catch (DataAccessException ex) {
      throw new KpiStoreException("Failed to archive rows for " + month, ex);
    }
  }

  @Override
  public List<Observation> load(YearMonth month) {
    String sql = """
      SELECT %s
      FROM kpi_history_archive
      WHERE year_month = :year_month
      ORDER BY as_of_date, section, metric_key, window_days
    """.formatted(JdbcRows.OBSERVATION_COLUMNS);
    try {
      return jdbc.query(sql, Map.of("year_month", month.toString()), JdbcRows.OBSERVATION);
    } catch (DataAccessException ex) {
      throw new KpiStoreException("Failed to read archive for " + month, ex);
    }
  }
}
