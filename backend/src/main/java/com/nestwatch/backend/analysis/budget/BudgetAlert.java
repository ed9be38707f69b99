package com.nestwatch.backend.analysis.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;

/** Threshold crossing for one budget metric within one window. */
public record BudgetAlert(
    BudgetMetric metric,
    int thresholdPercent,
    BigDecimal used,
    BigDecimal limit,
    Instant windowStart,
    Instant raisedAt) {

  public double percentUsed() {
    if (limit.signum() == 0) {
      return 0;
    }
    return used.multiply(BigDecimal.valueOf(100)).divide(limit, 1, RoundingMode.HALF_UP).doubleValue();
  }

  public boolean exhausted() {
    return thresholdPercent >= 100;
  }

  public String message() {
    String unit = metric == BudgetMetric.DAILY_COST ? " USD" : " tokens";
    return String.format(
        Locale.ROOT,
        "LLM budget %s: %s at %.1f%% (%s/%s%s)",
        exhausted() ? "exhausted" : "warning",
        metric.label(),
        percentUsed(),
        used.stripTrailingZeros().toPlainString(),
        limit.stripTrailingZeros().toPlainString(),
        unit);
  }
}
