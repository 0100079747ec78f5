package com.ospicorp.kpimonitor.threshold;

import com.ospicorp.kpimonitor.history.ValueType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the latest windowed aggregate of a metric against its configured thresholds.
 * Always returns a result; bounds and signals that lack data are left empty.
 */
public class ThresholdEvaluator {
  private static final Logger log = LoggerFactory.getLogger(ThresholdEvaluator.class);

  private final ThresholdConfigRegistry registry;

  public ThresholdEvaluator(ThresholdConfigRegistry registry) {
    this.registry = registry;
  }

  public ThresholdResult evaluate(MetricSeries series, int windowDays) {
    ThresholdConfig config = registry.forMetric(series.metricKey());
    ThresholdResult result = evaluate(series.points(), config, series.valueType(), windowDays);
    if (log.isDebugEnabled()) {
      log.debug("{}/{} w={} -> {} [{}] lower={} upper={} z={} pct={}", series.section(),
          series.metricKey(), windowDays, result.status().label(), result.signalCodes(),
          result.lowerThreshold(), result.upperThreshold(), result.seasonalZscore(),
          result.pctChange());
    }
    return result;
  }

  public static ThresholdResult evaluate(List<DataPoint> daily, ThresholdConfig config,
      ValueType valueType, int windowDays) {
    if (config instanceof DynamicThresholds dynamic) {
      return evaluateDynamic(daily, dynamic, valueType, windowDays);
    }
    return evaluateStatic(daily, (StaticThresholds) config, valueType, windowDays);
  }

  private static ThresholdResult evaluateStatic(List<DataPoint> daily, StaticThresholds config,
      ValueType valueType, int windowDays) {
    List<DataPoint> rolled = WindowAggregator.rolling(daily, windowDays, valueType);
    if (rolled.isEmpty()) return ThresholdResult.neutral(false);

    double current = last(rolled);
    List<Signal> signals = new ArrayList<>(2);
    Double lower = config.lowerThreshold();
    Double upper = config.upperThreshold();
    if (lower != null && config.direction().allows(Signal.L) && current <= lower) {
      signals.add(Signal.L);
    }
    if (upper != null && config.direction().allows(Signal.U) && current >= upper) {
      signals.add(Signal.U);
    }
    AlertStatus status = SignalClassifier.classify(signals.size(), config.policy());
    return new ThresholdResult(status, lower, upper, pctChange(rolled), null, signals, 0, 0,
        false);
  }

  private static ThresholdResult evaluateDynamic(List<DataPoint> daily, DynamicThresholds config,
      ValueType valueType, int windowDays) {
    boolean filtered = !config.excludedWeekdays().isEmpty();
    List<DataPoint> kept = WeekdayFilter.exclude(daily, config.excludedWeekdays());
    List<DataPoint> rolled = WindowAggregator.rolling(kept, windowDays, valueType);
    if (rolled.isEmpty()) return ThresholdResult.neutral(filtered);

    double current = last(rolled);
    List<Signal> signals = new ArrayList<>(4);

    Double lower = null;
    Double upper = null;
    int rollingUsed = 0;
    if (rolled.size() >= config.minHistoryPoints() && rolled.size() >= config.window()) {
      List<Double> trailing = values(rolled.subList(rolled.size() - config.window(), rolled.size()));
      double mean = Statistics.mean(trailing);
      double std = Statistics.std(trailing);
      lower = mean - config.k() * std;
      upper = mean + config.k() * std;
      rollingUsed = Math.min(rolled.size(), config.window());
      if (config.enabled(Signal.L) && config.direction().allows(Signal.L) && current <= lower) {
        signals.add(Signal.L);
      }
      if (config.enabled(Signal.U) && config.direction().allows(Signal.U) && current >= upper) {
        signals.add(Signal.U);
      }
    }

    List<Double> seasonal = sameMonthDay(rolled);
    Double zscore = null;
    if (seasonal.size() >= config.minSeasonalPoints()) {
      double std = Statistics.std(seasonal);
      if (std > 0.0) {
        zscore = (current - Statistics.mean(seasonal)) / std;
        if (config.enabled(Signal.Z) && Math.abs(zscore) >= config.zScoreLimit()) {
          signals.add(Signal.Z);
        }
      }
    }

    Double pct = pctChange(rolled);
    if (pct != null && config.enabled(Signal.P) && Math.abs(pct) >= config.percentDrop()) {
      signals.add(Signal.P);
    }

    AlertStatus status = SignalClassifier.classify(signals.size(), config.policy());
    return new ThresholdResult(status, lower, upper, pct, zscore, signals, rollingUsed,
        seasonal.size(), filtered);
  }

  // Rolling values on earlier dates sharing the latest date's month and day
  private static List<Double> sameMonthDay(List<DataPoint> rolled) {
    LocalDate latest = rolled.get(rolled.size() - 1).date();
    List<Double> out = new ArrayList<>();
    for (int i = 0; i < rolled.size() - 1; ++i) {
      LocalDate d = rolled.get(i).date();
      if (d.getMonthValue() == latest.getMonthValue()
          && d.getDayOfMonth() == latest.getDayOfMonth()) {
        out.add(rolled.get(i).value());
      }
    }
    return out;
  }

  private static Double pctChange(List<DataPoint> rolled) {
    if (rolled.size() < 2) return null;
    double previous = rolled.get(rolled.size() - 2).value();
    if (previous == 0.0) return null;
    return (last(rolled) - previous) / previous;
  }

  private static double last(List<DataPoint> rolled) {
    return rolled.get(rolled.size() - 1).value();
  }

  private static List<Double> values(List<DataPoint> points) {
    List<Double> out = new ArrayList<>(points.size());
    for (DataPoint p : points) out.add(p.value());
    return out;
  }
}
