package com.ospicorp.kpimonitor.threshold;

public final class SignalClassifier {
  private SignalClassifier() {
  }

  public static AlertStatus classify(int signalCount, AlertPolicy policy) {
    if (signalCount >= policy.redAt()) {
      return AlertStatus.RED;
    }
    if (signalCount >= policy.yellowAt()) {
      return AlertStatus.YELLOW;
    }
    return AlertStatus.GREEN;
  }
}
