package com.ospicorp.kpimonitor.store;

import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

final class JdbcRows {
  static final String OBSERVATION_COLUMNS =
      "as_of_date, window_days, section, metric_key, metric_label, value, value_type, source, "
          + "refreshed_at";
  static final String OBSERVATION_PARAMS =
      ":as_of_date, :window_days, :section, :metric_key, :metric_label, :value, :value_type, "
          + ":source, :refreshed_at";

  static final RowMapper<Observation> OBSERVATION = (rs, i) -> new Observation(
      rs.getDate("as_of_date").toLocalDate(),
      rs.getInt("window_days"),
      rs.getString("section"),
      rs.getString("metric_key"),
      rs.getString("metric_label"),
      rs.getDouble("value"),
      ValueType.fromCode(rs.getString("value_type")),
      rs.getString("source"),
      instant(rs, "refreshed_at"));

  private JdbcRows() {
  }

  static MapSqlParameterSource params(Observation o) {
    return new MapSqlParameterSource()
        .addValue("as_of_date", Date.valueOf(o.asOfDate()))
        .addValue("window_days", o.windowDays())
        .addValue("section", o.section())
        .addValue("metric_key", o.metricKey())
        .addValue("metric_label", o.metricLabel())
        .addValue("value", o.value())
        .addValue("value_type", o.valueType().code())
        .addValue("source", o.source())
        .addValue("refreshed_at", timestamp(o.refreshedAt()));
  }

  static SqlParameterSource[] batch(List<MapSqlParameterSource> params) {
    return params.toArray(new SqlParameterSource[0]);
  }

  static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double v = rs.getDouble(column);
    return rs.wasNull() ? null : v;
  }
}
