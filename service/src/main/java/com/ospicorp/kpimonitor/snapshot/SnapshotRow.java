package com.ospicorp.kpimonitor.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.kpimonitor.history.ValueType;
import com.ospicorp.kpimonitor.threshold.AlertStatus;
import java.time.Instant;
import java.time.LocalDate;

@JsonPropertyOrder({"as_of_date", "window_days", "section", "metric_key", "metric_label", "value",
    "value_type", "source", "status", "lower_threshold", "upper_threshold", "pct_change",
    "seasonal_zscore", "signal_count", "signals", "rolling_points_used", "seasonal_points_used",
    "weekday_filter_applied", "refreshed_at"})
public record SnapshotRow(
    @JsonProperty("as_of_date") LocalDate asOfDate,
    @JsonProperty("window_days") int windowDays,
    @JsonProperty("section") String section,
    @JsonProperty("metric_key") String metricKey,
    @JsonProperty("metric_label") String metricLabel,
    @JsonProperty("value") double value,
    @JsonProperty("value_type") ValueType valueType,
    @JsonProperty("source") String source,
    @JsonProperty("status") AlertStatus status,
    @JsonProperty("lower_threshold") Double lowerThreshold,
    @JsonProperty("upper_threshold") Double upperThreshold,
    @JsonProperty("pct_change") Double pctChange,
    @JsonProperty("seasonal_zscore") Double seasonalZscore,
    @JsonProperty("signal_count") int signalCount,
    @JsonProperty("signals") String signals,
    @JsonProperty("rolling_points_used") int rollingPointsUsed,
    @JsonProperty("seasonal_points_used") int seasonalPointsUsed,
    @JsonProperty("weekday_filter_applied") boolean weekdayFilterApplied,
    @JsonProperty("refreshed_at") Instant refreshedAt
) {

  public static final String SOURCE = "window_rollup_from_history";

  public SnapshotRow {
    signals = signals == null ? "" : signals;
  }
}
