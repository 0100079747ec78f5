package com.ospicorp.kpimonitor.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;

public record ObservationRequest(
    @JsonProperty("as_of_date") @NotNull LocalDate asOfDate,
    @JsonProperty("window_days") @Positive Integer windowDays,
    @JsonProperty("section") @NotBlank @Size(max = 64) String section,
    @JsonProperty("metric_key") @NotBlank @Pattern(regexp = METRIC_KEY_REGEX) String metricKey,
    @JsonProperty("metric_label") @Size(max = 200) String metricLabel,
    @JsonProperty("value") @NotNull Double value,
    @JsonProperty("value_type") @Pattern(regexp = "(?i)count|rate") String valueType,
    @JsonProperty("source") @Size(max = 100) String source
) {
  static final String METRIC_KEY_REGEX = "^[A-Za-z0-9_.-]{1,64}$";

  Observation toObservation(Instant refreshedAt) {
    String label = metricLabel == null || metricLabel.isBlank() ? metricKey : metricLabel;
    String src = source == null || source.isBlank() ? "api" : source;
    return new Observation(asOfDate, windowDays == null ? Observation.DAILY : windowDays,
        section.trim(), metricKey.trim(), label, value, ValueType.fromCode(valueType), src,
        refreshedAt);
  }
}
