package com.nestwatch.backend.analysis.api;

import com.nestwatch.backend.analysis.budget.BudgetUsageSnapshot;
import com.nestwatch.backend.analysis.circuit.CircuitSnapshot;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "LLM usage, quota and protection state")
public record UsageStatusResponse(
    BudgetUsageSnapshot budget,
    RateLimit rateLimit,
    List<CircuitSnapshot> circuits,
    int inFlightAnalyses) {

  public record RateLimit(
      double availableTokens, double capacity, double refillPerSecond, long retryAfterMillis) {}
}
