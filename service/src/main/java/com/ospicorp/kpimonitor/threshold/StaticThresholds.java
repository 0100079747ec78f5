package com.ospicorp.kpimonitor.threshold;

import java.util.Objects;

public record StaticThresholds(
    Direction direction,
    Double lowerThreshold,
    Double upperThreshold,
    AlertPolicy policy
) implements ThresholdConfig {

  static final StaticThresholds UNCONFIGURED =
      new StaticThresholds(Direction.BOTH, null, null, AlertPolicy.STRICT);

  public StaticThresholds {
    direction = Objects.requireNonNullElse(direction, Direction.BOTH);
    policy = Objects.requireNonNullElse(policy, AlertPolicy.STRICT);
  }
}
