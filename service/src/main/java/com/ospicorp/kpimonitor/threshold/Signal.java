package com.ospicorp.kpimonitor.threshold;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum Signal {
  L("lower bound breach"),
  U("upper bound breach"),
  Z("seasonal z-score breach"),
  P("percent change breach");

  private static final String SEPARATOR = "|";

  private final String description;

  Signal(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

  public static Optional<Signal> fromCode(String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Signal.valueOf(code.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }

  public static String join(List<Signal> signals) {
    return signals.stream().map(Signal::name).collect(Collectors.joining(SEPARATOR));
  }
}
