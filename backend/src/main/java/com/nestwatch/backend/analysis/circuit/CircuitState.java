package com.nestwatch.backend.analysis.circuit;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CircuitState {
  CLOSED,
  OPEN,
  HALF_OPEN;

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
