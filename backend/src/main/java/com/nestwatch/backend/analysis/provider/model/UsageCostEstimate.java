package com.nestwatch.backend.analysis.provider.model;

import java.math.BigDecimal;

public record UsageCostEstimate(
    int promptTokens, int completionTokens, BigDecimal costUsd, UsageSource usageSource) {

  public UsageCostEstimate {
    costUsd = costUsd != null ? costUsd : BigDecimal.ZERO;
    usageSource = usageSource != null ? usageSource : UsageSource.UNKNOWN;
  }

  public static UsageCostEstimate empty() {
    return new UsageCostEstimate(0, 0, BigDecimal.ZERO, UsageSource.UNKNOWN);
  }

  public long totalTokens() {
    return (long) promptTokens + completionTokens;
  }
}
