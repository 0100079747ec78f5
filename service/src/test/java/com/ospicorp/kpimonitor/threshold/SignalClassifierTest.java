package com.ospicorp.kpimonitor.threshold;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SignalClassifierTest {

  @Test
  void dynamicDefaultPolicyNeedsTwoSignalsForRed() {
    assertEquals(AlertStatus.GREEN, SignalClassifier.classify(0, AlertPolicy.DYNAMIC_DEFAULT));
    assertEquals(AlertStatus.YELLOW, SignalClassifier.classify(1, AlertPolicy.DYNAMIC_DEFAULT));
    assertEquals(AlertStatus.RED, SignalClassifier.classify(2, AlertPolicy.DYNAMIC_DEFAULT));
    assertEquals(AlertStatus.RED, SignalClassifier.classify(4, AlertPolicy.DYNAMIC_DEFAULT));
  }

  @Test
  void strictPolicyTurnsRedOnFirstSignal() {
    assertEquals(AlertStatus.GREEN, SignalClassifier.classify(0, AlertPolicy.STRICT));
    assertEquals(AlertStatus.RED, SignalClassifier.classify(1, AlertPolicy.STRICT));
  }

  @Test
  void customPolicyCanKeepSingleSignalGreen() {
    var lenient = new AlertPolicy(2, 3);
    assertEquals(AlertStatus.GREEN, SignalClassifier.classify(1, lenient));
    assertEquals(AlertStatus.YELLOW, SignalClassifier.classify(2, lenient));
    assertEquals(AlertStatus.RED, SignalClassifier.classify(3, lenient));
  }
}
