package com.nestwatch.backend.analysis.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AnalysisProfile {
  JSON,
  CHAT;

  @JsonCreator
  public static AnalysisProfile from(String value) {
    if (value == null || value.isBlank()) {
      return JSON;
    }
    return AnalysisProfile.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
