package com.ospicorp.kpimonitor.history;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public final class KpiRowFactory {
  public static final String DEFAULT_SOURCE = "daily_refresh";

  private KpiRowFactory() {
  }

  public static Observation dailyRow(LocalDate asOfDate, String section, String metricKey,
      String metricLabel, double value, ValueType valueType, String source, Clock clock) {
    String label = metricLabel == null || metricLabel.isBlank() ? metricKey : metricLabel;
    String src = source == null || source.isBlank() ? DEFAULT_SOURCE : source;
    ValueType type = valueType == null ? ValueType.COUNT : valueType;
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    return new Observation(asOfDate, Observation.DAILY, section, metricKey, label, value, type, src,
        now);
  }
}
