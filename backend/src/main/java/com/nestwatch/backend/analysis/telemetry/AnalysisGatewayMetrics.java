package com.nestwatch.backend.analysis.telemetry;

import com.nestwatch.backend.analysis.api.AnalysisResult;
import com.nestwatch.backend.analysis.budget.BudgetMetric;
import com.nestwatch.backend.analysis.circuit.CircuitState;
import com.nestwatch.backend.analysis.provider.model.UsageCostEstimate;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class AnalysisGatewayMetrics {

  private final MeterRegistry meterRegistry;

  public AnalysisGatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordResult(AnalysisResult result) {
    String reason = result.fallbackReason() != null ? result.fallbackReason().value() : "none";
    meterRegistry
        .counter("analysis.requests", "source", lower(result.source().name()), "reason", reason)
        .increment();
  }

  public void recordProviderCall(String provider, String outcome, long durationNanos) {
    meterRegistry.counter("analysis.provider.calls", "provider", provider, "outcome", outcome).increment();
    meterRegistry
        .timer("analysis.provider.latency", "provider", provider, "outcome", outcome)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }

  public void recordUsage(String provider, UsageCostEstimate usage) {
    meterRegistry
        .summary("analysis.provider.tokens", "provider", provider, "usage_source", lower(usage.usageSource().name()))
        .record(usage.totalTokens());
    if (usage.costUsd().signum() > 0) {
      meterRegistry.counter("analysis.provider.cost.usd", "provider", provider).increment(usage.costUsd().doubleValue());
    }
  }

  public void recordCircuitTransition(String provider, CircuitState from, CircuitState to) {
    meterRegistry
        .counter(
            "analysis.circuit.transitions",
            "provider",
            provider,
            "from",
            from.jsonValue(),
            "to",
            to.jsonValue())
        .increment();
  }

  public void recordBudgetRejection(BudgetMetric metric) {
    meterRegistry.counter("analysis.budget.rejections", "metric", lower(metric.name())).increment();
  }

  public void recordRateLimited() {
    meterRegistry.counter("analysis.ratelimit.rejections").increment();
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
