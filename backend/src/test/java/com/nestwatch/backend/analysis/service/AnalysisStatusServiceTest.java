package com.nestwatch.backend.analysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.nestwatch.backend.analysis.api.ProvidersStatusResponse;
import com.nestwatch.backend.analysis.api.UsageStatusResponse;
import com.nestwatch.backend.analysis.budget.BudgetMeter;
import com.nestwatch.backend.analysis.cache.AnalysisResponseCache;
import com.nestwatch.backend.analysis.cache.InMemoryAnalysisCacheStore;
import com.nestwatch.backend.analysis.circuit.CircuitBreakerRegistry;
import com.nestwatch.backend.analysis.circuit.CircuitSnapshot;
import com.nestwatch.backend.analysis.circuit.CircuitState;
import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.provider.ProviderErrorKind;
import com.nestwatch.backend.analysis.ratelimit.TokenBucketRateLimiter;
import com.nestwatch.backend.analysis.support.AnalysisFixtures;
import com.nestwatch.backend.analysis.support.FakeAnalysisProvider;
import com.nestwatch.backend.analysis.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

class AnalysisStatusServiceTest {

  private MutableClock clock;
  private CircuitBreakerRegistry circuitBreakers;
  private AnalysisResponseCache cache;
  private BudgetMeter budgetMeter;
  private AnalysisStatusService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(AnalysisFixtures.NOW);
    circuitBreakers =
        new CircuitBreakerRegistry(new AnalysisGatewayProperties.CircuitBreaker(), clock, (provider, from, to) -> {});
    cache =
        new AnalysisResponseCache(new InMemoryAnalysisCacheStore(10, clock), Duration.ofMinutes(5));
    budgetMeter = new BudgetMeter(40_000, 200_000, BigDecimal.ZERO, clock, alert -> {}, Runnable::run);
    ProviderRegistry registry =
        new ProviderRegistry(
            List.of(new FakeAnalysisProvider("bedrock"), new FakeAnalysisProvider("nemo_local").healthy(false)));
    service =
        new AnalysisStatusService(
            budgetMeter,
            new TokenBucketRateLimiter(5, 10),
            circuitBreakers,
            cache,
            registry,
            new ProviderChainResolver(registry, List.of("bedrock", "openai"), Map.of()));
  }

  @Test
  void usageReportsBudgetLimiterAndCircuits() {
    budgetMeter.charge(1_000, BigDecimal.ZERO);

    UsageStatusResponse usage = service.usage();

    assertThat(usage.budget().hourlyTokens()).isEqualTo(1_000);
    assertThat(usage.budget().hourlyTokenLimit()).isEqualTo(40_000);
    assertThat(usage.rateLimit().capacity()).isEqualTo(10.0);
    assertThat(usage.circuits()).extracting(CircuitSnapshot::provider).containsExactly("bedrock", "nemo_local");
    assertThat(usage.inFlightAnalyses()).isZero();
  }

  @Test
  void providersListsRegistrationOrderWithChainMembership() {
    ProvidersStatusResponse providers = service.providers();

    assertThat(providers.chain()).containsExactly("bedrock", "openai");
    assertThat(providers.providers())
        .extracting(
            ProvidersStatusResponse.ProviderStatus::name,
            ProvidersStatusResponse.ProviderStatus::inChain,
            ProvidersStatusResponse.ProviderStatus::healthy)
        .containsExactly(
            tuple("bedrock", true, true),
            tuple("nemo_local", false, false));
  }

  @Test
  void resetClosesAnOpenCircuit() {
    circuitBreakers.breaker("bedrock").recordFailure(ProviderErrorKind.QUOTA_EXHAUSTED);

    CircuitSnapshot snapshot = service.resetCircuit("bedrock");

    assertThat(snapshot.state()).isEqualTo(CircuitState.CLOSED);
    assertThat(snapshot.consecutiveFailures()).isZero();
  }

  @Test
  void resetOfUnknownProviderIsNotFound() {
    assertThatThrownBy(() -> service.resetCircuit("openai"))
        .isInstanceOfSatisfying(
            ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
  }

  @Test
  void clearCacheDropsStoredResults() {
    cache.getOrCompute("llm:analysis:card:1", () -> AnalysisFixtures.liveResult("bedrock"));

    service.clearCache();

    assertThat(cache.getOrCompute("llm:analysis:card:1", () -> AnalysisFixtures.liveResult("openai")).provider())
        .isEqualTo("openai");
  }
}
