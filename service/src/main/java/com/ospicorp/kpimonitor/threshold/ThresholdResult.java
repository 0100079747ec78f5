package com.ospicorp.kpimonitor.threshold;

import java.util.List;

public record ThresholdResult(
    AlertStatus status,
    Double lowerThreshold,
    Double upperThreshold,
    Double pctChange,
    Double seasonalZscore,
    List<Signal> signals,
    int rollingPointsUsed,
    int seasonalPointsUsed,
    boolean weekdayFilterApplied
) {

  public ThresholdResult {
    signals = List.copyOf(signals);
  }

  // Nothing could be computed: flagged for attention rather than reported healthy
  public static ThresholdResult neutral(boolean weekdayFilterApplied) {
    return new ThresholdResult(AlertStatus.YELLOW, null, null, null, null, List.of(), 0, 0,
        weekdayFilterApplied);
  }

  public int signalCount() {
    return signals.size();
  }

  public String signalCodes() {
    return Signal.join(signals);
  }
}
