package com.ospicorp.kpimonitor.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ValueType {
  COUNT("count"),
  RATE("rate");

  private final String code;

  ValueType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  // Anything other than "count" is averaged like a rate; blank means count
  @JsonCreator
  public static ValueType fromCode(String code) {
    if (code == null || code.isBlank()) return COUNT;
    return "count".equals(code.trim().toLowerCase(Locale.ROOT)) ? COUNT : RATE;
  }
}
