package com.nestwatch.backend.analysis.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AnalysisSource {
  CACHE,
  LIVE,
  FALLBACK;

  @JsonCreator
  public static AnalysisSource from(String value) {
    return AnalysisSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
