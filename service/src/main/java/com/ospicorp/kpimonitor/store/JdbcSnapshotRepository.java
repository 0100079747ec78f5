package com.ospicorp.kpimonitor.store;

import com.ospicorp.kpimonitor.history.ValueType;
import com.ospicorp.kpimonitor.snapshot.SnapshotRepository;
import com.ospicorp.kpimonitor.snapshot.SnapshotRow;
import com.ospicorp.kpimonitor.threshold.AlertStatus;
import java.sql.Date;
import java.sql.Types;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

public class JdbcSnapshotRepository implements SnapshotRepository {
  private static final String COLUMNS = """
      as_of_date, window_days, section, metric_key, metric_label, value, value_type, source, \
      status, lower_threshold, upper_threshold, pct_change, seasonal_zscore, signal_count, \
      signals, rolling_points_used, seasonal_points_used, weekday_filter_applied, refreshed_at""";

  private static final RowMapper<SnapshotRow> MAPPER = (rs, i) -> new SnapshotRow(
      rs.getDate("as_of_date").toLocalDate(),
      rs.getInt("window_days"),
      rs.getString("section"),
      rs.getString("metric_key"),
      rs.getString("metric_label"),
      rs.getDouble("value"),
      ValueType.fromCode(rs.getString("value_type")),
      rs.getString("source"),
      AlertStatus.fromLabel(rs.getString("status")).orElse(AlertStatus.YELLOW),
      JdbcRows.nullableDouble(rs, "lower_threshold"),
      JdbcRows.nullableDouble(rs, "upper_threshold"),
      JdbcRows.nullableDouble(rs, "pct_change"),
      JdbcRows.nullableDouble(rs, "seasonal_zscore"),
      rs.getInt("signal_count"),
      rs.getString("signals"),
      rs.getInt("rolling_points_used"),
      rs.getInt("seasonal_points_used"),
      rs.getBoolean("weekday_filter_applied"),
      JdbcRows.instant(rs, "refreshed_at"));

  private final NamedParameterJdbcTemplate jdbc;

  public JdbcSnapshotRepository(NamedParameterJdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  @Transactional
  public void replace(List<SnapshotRow> rows) {
    String insert = """
      INSERT INTO kpi_serving_snapshot (%s)
      VALUES (:as_of_date, :window_days, :section, :metric_key, :metric_label, :value,
        :value_type, :source, :status, :lower_threshold, :upper_threshold, :pct_change,
        :seasonal_zscore, :signal_count, :signals, :rolling_points_used, :seasonal_points_used,
        :weekday_filter_applied, :refreshed_at)
    """.formatted(COLUMNS);
    try {
      jdbc.getJdbcTemplate().update("DELETE FROM kpi_serving_snapshot");
      if (!rows.isEmpty()) {
        jdbc.batchUpdate(insert, JdbcRows.batch(rows.stream().map(JdbcSnapshotRepository::params)
            .toList()));
      }
    } catch (DataAccessException ex) {
      throw new KpiStoreException("Failed to replace kpi_serving_snapshot", ex);
    }
  }

  @Override
  public List<SnapshotRow> load() {
    String sql = "SELECT " + COLUMNS
        + " FROM kpi_serving_snapshot ORDER BY section, metric_key, window_days";
    try {
      return jdbc.query(sql, MAPPER);
    } catch (DataAccessException ex) {
      throw new KpiStoreException("Failed to read kpi_serving_snapshot", ex);
    }
  }

  private static MapSqlParameterSource params(SnapshotRow r) {
    return new MapSqlParameterSource()
        .addValue("as_of_date", Date.valueOf(r.asOfDate()))
        .addValue("window_days", r.windowDays())
        .addValue("section", r.section())
        .addValue("metric_key", r.metricKey())
        .addValue("metric_label", r.metricLabel())
        .addValue("value", r.value())
        .addValue("value_type", r.valueType().code())
        .addValue("source", r.source())
        .addValue("status", r.status().label())
        .addValue("lower_threshold", r.lowerThreshold(), Types.DOUBLE)
        .addValue("upper_threshold", r.upperThreshold(), Types.DOUBLE)
        .addValue("pct_change", r.pctChange(), Types.DOUBLE)
        .addValue("seasonal_zscore", r.seasonalZscore(), Types.DOUBLE)
        .addValue("signal_count", r.signalCount())
        .addValue("signals", r.signals())
        .addValue("rolling_points_used", r.rollingPointsUsed())
        .addValue("seasonal_points_used", r.seasonalPointsUsed())
        .addValue("weekday_filter_applied", r.weekdayFilterApplied())
        .addValue("refreshed_at", JdbcRows.timestamp(r.refreshedAt()));
  }
}
