package com.ospicorp.kpimonitor.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.kpimonitor.history.Observation;
import com.ospicorp.kpimonitor.history.ValueType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raw history row as read from a file, before any column is parsed.
 */
record ObservationRecord(
    @JsonProperty("as_of_date") String asOfDate,
    @JsonProperty("window_days") String windowDays,
    @JsonProperty("section") String section,
    @JsonProperty("metric_key") String metricKey,
    @JsonProperty("metric_label") String metricLabel,
    @JsonProperty("value") String value,
    @JsonProperty("value_type") String valueType,
    @JsonProperty("source") String source,
    @JsonProperty("refreshed_at") String refreshedAt
) {
  private static final Logger log = LoggerFactory.getLogger(ObservationRecord.class);

  /** Parses the row, or logs and returns empty when the date, value, window or key is unusable. */
  Optional<Observation> toObservation() {
    if (isBlank(section) || isBlank(metricKey)) {
      log.warn("Dropping history row without section/metric_key: {}", this);
      return Optional.empty();
    }
    if (isBlank(asOfDate) || isBlank(windowDays) || isBlank(value)) {
      log.warn("Dropping history row with missing date/window/value: {}", this);
      return Optional.empty();
    }
    try {
      LocalDate date = parseDate(asOfDate);
      int window = (int) Double.parseDouble(windowDays.trim());
      double parsed = Double.parseDouble(value.trim());
      if (Double.isNaN(parsed) || window < 1) {
        log.warn("Dropping history row with unusable value/window: {}", this);
        return Optional.empty();
      }
      return Optional.of(new Observation(date, window, section.trim(), metricKey.trim(),
          isBlank(metricLabel) ? metricKey.trim() : metricLabel, parsed,
          ValueType.fromCode(valueType), source, parseInstant(refreshedAt)));
    } catch (DateTimeParseException | NumberFormatException ex) {
      log.warn("Dropping malformed history row {}: {}", this, ex.getMessage());
      return Optional.empty();
    }
  }

  private static LocalDate parseDate(String raw) {
    String text = raw.trim();
    if (text.length() > 10 && (text.charAt(10) == 'T' || text.charAt(10) == ' ')) {
      text = text.substring(0, 10);
    }
    return LocalDate.parse(text);
  }

  // refreshed_at is provenance only; an unreadable value becomes null rather than dropping the row
  private static Instant parseInstant(String raw) {
    if (isBlank(raw)) return null;
    String text = raw.trim().replace(' ', 'T');
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException ex) {
      try {
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException notLocal) {
        log.debug("Unreadable refreshed_at '{}'", raw);
        return null;
      }
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
