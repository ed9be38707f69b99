package com.nestwatch.backend.analysis.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

public enum EventPriority {
  P1,
  P2,
  P3;

  @JsonCreator
  public static EventPriority from(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return EventPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  /** Rank for ordering, P1 first. */
  public int rank() {
    return ordinal();
  }
}
