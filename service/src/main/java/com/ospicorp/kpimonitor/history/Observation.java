package com.ospicorp.kpimonitor.history;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One persisted metric value. Rows sharing {@link #key()} are duplicates; the later write wins.
 */
@JsonPropertyOrder({"as_of_date", "window_days", "section", "metric_key", "metric_label", "value",
    "value_type", "source", "refreshed_at"})
public record Observation(
    @JsonProperty("as_of_date") LocalDate asOfDate,
    @JsonProperty("window_days") int windowDays,
    @JsonProperty("section") String section,
    @JsonProperty("metric_key") String metricKey,
    @JsonProperty("metric_label") String metricLabel,
    @JsonProperty("value") double value,
    @JsonProperty("value_type") ValueType valueType,
    @JsonProperty("source") String source,
    @JsonProperty("refreshed_at") Instant refreshedAt
) {

  public static final int DAILY = 1;

  @JsonIgnore
  public ObservationKey key() {
    return new ObservationKey(asOfDate, windowDays, section, metricKey);
  }

  @JsonIgnore
  public boolean isDaily() {
    return windowDays == DAILY;
  }
}
