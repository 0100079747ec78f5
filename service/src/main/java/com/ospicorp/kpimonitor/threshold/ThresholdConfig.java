package com.ospicorp.kpimonitor.threshold;

/**
 * Per-metric threshold configuration, either fixed bounds or adaptive rolling statistics.
 */
public sealed interface ThresholdConfig permits StaticThresholds, DynamicThresholds {

  Direction direction();

  AlertPolicy policy();

  /** Configuration used for metrics that have no entry: no bounds, strict policy. */
  static ThresholdConfig unconfigured() {
    return StaticThresholds.UNCONFIGURED;
  }
}
