package com.nestwatch.backend.analysis.circuit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nestwatch.backend.analysis.provider.ProviderErrorKind;
import java.time.Duration;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircuitSnapshot(
    String provider,
    CircuitState state,
    int consecutiveFailures,
    Instant openedAt,
    Instant retryAt,
    ProviderErrorKind lastFailure,
    Duration cooldown) {}
