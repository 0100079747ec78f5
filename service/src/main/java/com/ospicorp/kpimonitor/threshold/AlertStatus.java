package com.ospicorp.kpimonitor.threshold;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum AlertStatus {
  GREEN("Green"),
  YELLOW("Yellow"),
  RED("Red");

  private final String label;

  AlertStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public static Optional<AlertStatus> fromLabel(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (AlertStatus status : values()) {
      if (status.label.equalsIgnoreCase(value.trim())) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
