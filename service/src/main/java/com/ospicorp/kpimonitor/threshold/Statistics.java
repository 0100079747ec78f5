package com.ospicorp.kpimonitor.threshold;

import java.util.List;

// Population moments (divisor N)
final class Statistics {
  private Statistics() {
  }

  static double mean(List<Double> values) {
    double sum = 0.0;
    for (double v : values) sum += v;
    return sum / values.size();
  }

  static double std(List<Double> values) {
    double mean = mean(values);
    double squares = 0.0;
    for (double v : values) {
      double d = v - mean;
      squares += d * d;
    }
    return Math.sqrt(squares / values.size());
  }
}
