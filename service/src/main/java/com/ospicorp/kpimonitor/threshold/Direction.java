package com.ospicorp.kpimonitor.threshold;

import java.util.Locale;

/**
 * Which bound checks a metric is eligible for, independent of the bounds that are configured.
 */
public enum Direction {
  BOTH,
  LOWER_ONLY,
  UPPER_ONLY;

  public boolean allows(Signal signal) {
    return switch (this) {
      case BOTH -> signal == Signal.L || signal == Signal.U;
      case LOWER_ONLY -> signal == Signal.L;
      case UPPER_ONLY -> signal == Signal.U;
    };
  }

  // Unknown or missing values behave as BOTH
  public static Direction fromCode(String code) {
    if (code == null || code.isBlank()) {
      return BOTH;
    }
    try {
      return Direction.valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return BOTH;
    }
  }
}
