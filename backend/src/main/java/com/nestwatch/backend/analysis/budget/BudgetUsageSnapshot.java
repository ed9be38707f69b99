package com.nestwatch.backend.analysis.budget;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BudgetUsageSnapshot(
    long hourlyTokens,
    long hourlyTokenLimit,
    long dailyTokens,
    long dailyTokenLimit,
    BigDecimal hourlyCostUsd,
    BigDecimal dailyCostUsd,
    BigDecimal dailyCostLimitUsd,
    long hourlyRequests,
    long dailyRequests,
    Instant hourWindowStart,
    Instant dayWindowStart,
    double pctUsed,
    boolean exhausted) {}
