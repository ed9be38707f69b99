package com.nestwatch.backend.analysis.api;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Why a result was produced by the rule-based summarizer instead of a provider. */
public enum FallbackReason {
  POLICY_SKIPPED,
  BUDGET_EXCEEDED,
  RATE_LIMITED,
  CIRCUIT_OPEN,
  NO_PROVIDERS,
  PROVIDERS_EXHAUSTED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
