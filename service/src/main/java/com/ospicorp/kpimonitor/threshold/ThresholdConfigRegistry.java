package com.ospicorp.kpimonitor.threshold;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only lookup of threshold configuration by metric key. Keys match case-insensitively;
 * unknown keys resolve to {@link ThresholdConfig#unconfigured()}.
 */
public final class ThresholdConfigRegistry {
  private final Map<String, ThresholdConfig> configs;

  public ThresholdConfigRegistry(Map<String, ThresholdConfig> configs) {
    TreeMap<String, ThresholdConfig> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    copy.putAll(configs);
    this.configs = copy;
  }

  public static ThresholdConfigRegistry empty() {
    return new ThresholdConfigRegistry(Map.of());
  }

  public ThresholdConfig forMetric(String metricKey) {
    if (metricKey == null) {
      return ThresholdConfig.unconfigured();
    }
    return configs.getOrDefault(metricKey, ThresholdConfig.unconfigured());
  }

  public Set<String> configuredMetrics() {
    return configs.keySet();
  }
}
