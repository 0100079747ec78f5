package com.ospicorp.kpimonitor.threshold;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Adaptive thresholds: a rolling mean +/- k standard deviations band, a seasonal z-score against
 * the same calendar day in earlier years, and a period-over-period percent change.
 */
public record DynamicThresholds(
    Direction direction,
    double k,
    int window,
    double zScoreLimit,
    double percentDrop,
    int minHistoryPoints,
    int minSeasonalPoints,
    Set<DayOfWeek> excludedWeekdays,
    Set<Signal> signalsEnabled,
    AlertPolicy policy
) implements ThresholdConfig {

  public static final double DEFAULT_K = 1.0;
  public static final int DEFAULT_WINDOW = 30;
  public static final double DEFAULT_Z_SCORE_LIMIT = 2.0;
  public static final double DEFAULT_PERCENT_DROP = 0.5;
  public static final int DEFAULT_MIN_SEASONAL_POINTS = 5;
  static final int MIN_HISTORY_FLOOR = 10;

  public DynamicThresholds {
    if (window < 1) {
      throw new IllegalArgumentException("window must be at least 1, was " + window);
    }
    direction = Objects.requireNonNullElse(direction, Direction.BOTH);
    excludedWeekdays = excludedWeekdays == null ? Set.of() : Set.copyOf(excludedWeekdays);
    signalsEnabled = signalsEnabled == null ? Set.of(Signal.values()) : Set.copyOf(signalsEnabled);
    policy = Objects.requireNonNullElse(policy, AlertPolicy.DYNAMIC_DEFAULT);
  }

  public boolean enabled(Signal signal) {
    return signalsEnabled.contains(signal);
  }

  public static int defaultMinHistoryPoints(int window) {
    return Math.max(window, MIN_HISTORY_FLOOR);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private Direction direction = Direction.BOTH;
    private double k = DEFAULT_K;
    private int window = DEFAULT_WINDOW;
    private double zScoreLimit = DEFAULT_Z_SCORE_LIMIT;
    private double percentDrop = DEFAULT_PERCENT_DROP;
    private Integer minHistoryPoints;
    private int minSeasonalPoints = DEFAULT_MIN_SEASONAL_POINTS;
    private Set<DayOfWeek> excludedWeekdays = EnumSet.noneOf(DayOfWeek.class);
    private Set<Signal> signalsEnabled = EnumSet.allOf(Signal.class);
    private AlertPolicy policy = AlertPolicy.DYNAMIC_DEFAULT;

    private Builder() {
    }

    public Builder direction(Direction direction) {
      this.direction = direction;
      return this;
    }

    public Builder k(double k) {
      this.k = k;
      return this;
    }

    public Builder window(int window) {
      this.window = window;
      return this;
    }

    public Builder zScoreLimit(double zScoreLimit) {
      this.zScoreLimit = zScoreLimit;
      return this;
    }

    public Builder percentDrop(double percentDrop) {
      this.percentDrop = percentDrop;
      return this;
    }

    public Builder minHistoryPoints(int minHistoryPoints) {
      this.minHistoryPoints = minHistoryPoints;
      return this;
    }

    public Builder minSeasonalPoints(int minSeasonalPoints) {
      this.minSeasonalPoints = minSeasonalPoints;
      return this;
    }

    public Builder excludedWeekdays(Set<DayOfWeek> excludedWeekdays) {
      this.excludedWeekdays = excludedWeekdays;
      return this;
    }

    public Builder signalsEnabled(Set<Signal> signalsEnabled) {
      this.signalsEnabled = signalsEnabled;
      return this;
    }

    public Builder policy(AlertPolicy policy) {
      this.policy = policy;
      return this;
    }

    public DynamicThresholds build() {
      int history = minHistoryPoints != null ? minHistoryPoints : defaultMinHistoryPoints(window);
      return new DynamicThresholds(direction, k, window, zScoreLimit, percentDrop, history,
          minSeasonalPoints, excludedWeekdays, signalsEnabled, policy);
    }
  }
}
