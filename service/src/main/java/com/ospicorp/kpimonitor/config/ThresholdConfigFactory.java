package com.ospicorp.kpimonitor.config;

import com.ospicorp.kpimonitor.config.KpiProperties.AlertProperties;
import com.ospicorp.kpimonitor.config.ThresholdProperties.DynamicBlock;
import com.ospicorp.kpimonitor.config.ThresholdProperties.PolicyBlock;
import com.ospicorp.kpimonitor.config.ThresholdProperties.StaticBlock;
import com.ospicorp.kpimonitor.threshold.AlertPolicy;
import com.ospicorp.kpimonitor.threshold.Direction;
import com.ospicorp.kpimonitor.threshold.DynamicThresholds;
import com.ospicorp.kpimonitor.threshold.Signal;
import com.ospicorp.kpimonitor.threshold.StaticThresholds;
import com.ospicorp.kpimonitor.threshold.ThresholdConfig;
import com.ospicorp.kpimonitor.threshold.ThresholdConfigRegistry;
import com.ospicorp.kpimonitor.threshold.WeekdayFilter;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the bound {@code kpi.alerts} properties into typed threshold configurations.
 */
public final class ThresholdConfigFactory {
  private static final Logger log = LoggerFactory.getLogger(ThresholdConfigFactory.class);

  private ThresholdConfigFactory() {
  }

  public static ThresholdConfigRegistry registry(Map<String, AlertProperties> alerts) {
    Map<String, ThresholdConfig> configs = new LinkedHashMap<>();
    if (alerts != null) {
      alerts.forEach((metric, alert) -> {
        if (alert != null && alert.getThresholds() != null) {
          configs.put(metric, from(alert.getThresholds()));
        }
      });
    }
    log.info("Loaded threshold configuration for {} metrics", configs.size());
    return new ThresholdConfigRegistry(configs);
  }

  public static ThresholdConfig from(ThresholdProperties props) {
    String mode = props.getMode() == null ? "static" : props.getMode().trim().toLowerCase(Locale.ROOT);
    if ("dynamic".equals(mode)) {
      return dynamic(props.getDynamic() == null ? new DynamicBlock() : props.getDynamic(),
          props.getPolicy());
    }
    StaticBlock block = props.getStatic() == null ? new StaticBlock() : props.getStatic();
    return new StaticThresholds(Direction.fromCode(block.getDirection()), block.getLowerThreshold(),
        block.getUpperThreshold(), policy(props.getPolicy(), AlertPolicy.STRICT));
  }

  private static DynamicThresholds dynamic(DynamicBlock block, PolicyBlock policy) {
    int window = positiveInt(block.getWindow(), DynamicThresholds.DEFAULT_WINDOW);
    DynamicThresholds.Builder builder = DynamicThresholds.builder()
        .direction(Direction.fromCode(block.getDirection()))
        .k(nonZeroDouble(block.getK(), DynamicThresholds.DEFAULT_K))
        .window(window)
        .zScoreLimit(nonZeroDouble(block.getZScoreLim(), DynamicThresholds.DEFAULT_Z_SCORE_LIMIT))
        .percentDrop(nonZeroDouble(block.getPercentDrop(), DynamicThresholds.DEFAULT_PERCENT_DROP))
        .minHistoryPoints(nonNegativeInt(block.getMinHistoryPoints(),
            DynamicThresholds.defaultMinHistoryPoints(window)))
        .minSeasonalPoints(nonNegativeInt(block.getMinSeasonalPoints(),
            DynamicThresholds.DEFAULT_MIN_SEASONAL_POINTS))
        .excludedWeekdays(WeekdayFilter.parse(block.getExcludeWeekdays()))
        .policy(policy(policy, AlertPolicy.DYNAMIC_DEFAULT));
    if (block.getSignalsEnabled() != null) {
      builder.signalsEnabled(signals(block.getSignalsEnabled()));
    }
    return builder.build();
  }

  // A present policy block fills its missing cut-offs with 1/2; an absent one uses the mode default
  private static AlertPolicy policy(PolicyBlock block, AlertPolicy absent) {
    if (block == null) return absent;
    int yellow = block.getYellowIfSignalCountGte() != null
        ? block.getYellowIfSignalCountGte() : AlertPolicy.DEFAULT_YELLOW_AT;
    int red = block.getRedIfSignalCountGte() != null
        ? block.getRedIfSignalCountGte() : AlertPolicy.DEFAULT_RED_AT;
    return new AlertPolicy(yellow, red);
  }

  private static Set<Signal> signals(Iterable<String> codes) {
    Set<Signal> out = EnumSet.noneOf(Signal.class);
    for (String code : codes) {
      Signal.fromCode(code).ifPresentOrElse(out::add,
          () -> log.warn("Ignoring unknown signal code '{}'", code));
    }
    return out;
  }

  static double nonZeroDouble(String raw, double fallback) {
    if (raw == null || raw.isBlank()) return fallback;
    try {
      double v = Double.parseDouble(raw.trim());
      return v == 0.0 || Double.isNaN(v) ? fallback : v;
    } catch (NumberFormatException ex) {
      log.warn("Unparseable threshold value '{}', using {}", raw, fallback);
      return fallback;
    }
  }

  static int positiveInt(String raw, int fallback) {
    if (raw == null || raw.isBlank()) return fallback;
    try {
      int v = (int) Double.parseDouble(raw.trim());
      return v <= 0 ? fallback : v;
    } catch (NumberFormatException ex) {
      log.warn("Unparseable threshold value '{}', using {}", raw, fallback);
      return fallback;
    }
  }

  // Point-count floors accept 0, which disables the floor
  static int nonNegativeInt(String raw, int fallback) {
    if (raw == null || raw.isBlank()) return fallback;
    try {
      int v = (int) Double.parseDouble(raw.trim());
      return v < 0 ? fallback : v;
    } catch (NumberFormatException ex) {
      log.warn("Unparseable threshold value '{}', using {}", raw, fallback);
      return fallback;
    }
  }
}
