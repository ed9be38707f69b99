package com.nestwatch.backend.analysis.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knuddels.jtokkit.Encodings;
import com.nestwatch.backend.analysis.api.AnalysisProfile;
import com.nestwatch.backend.analysis.api.AnalysisResult;
import com.nestwatch.backend.analysis.api.AnalysisSource;
import com.nestwatch.backend.analysis.api.FallbackReason;
import com.nestwatch.backend.analysis.api.RequestContext;
import com.nestwatch.backend.analysis.budget.BudgetMeter;
import com.nestwatch.backend.analysis.cache.AnalysisCacheKeyFactory;
import com.nestwatch.backend.analysis.cache.AnalysisResponseCache;
import com.nestwatch.backend.analysis.cache.InMemoryAnalysisCacheStore;
import com.nestwatch.backend.analysis.circuit.CircuitBreakerRegistry;
import com.nestwatch.backend.analysis.circuit.CircuitState;
import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.fallback.FallbackSummarizer;
import com.nestwatch.backend.analysis.policy.AnalysisPolicyEngine;
import com.nestwatch.backend.analysis.prompt.AnalysisPromptFactory;
import com.nestwatch.backend.analysis.prompt.AnalysisResponseParser;
import com.nestwatch.backend.analysis.prompt.ChatSummaryRenderer;
import com.nestwatch.backend.analysis.prompt.EventContextCompactor;
import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import com.nestwatch.backend.analysis.provider.ProviderErrorKind;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import com.nestwatch.backend.analysis.provider.model.ProviderCompletion;
import com.nestwatch.backend.analysis.ratelimit.TokenBucketRateLimiter;
import com.nestwatch.backend.analysis.support.AnalysisFixtures;
import com.nestwatch.backend.analysis.support.FakeAnalysisProvider;
import com.nestwatch.backend.analysis.support.MutableClock;
import com.nestwatch.backend.analysis.telemetry.AnalysisGatewayMetrics;
import com.nestwatch.backend.analysis.token.JtokkitTokenUsageEstimator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalysisGatewayTest {

  private final FakeAnalysisProvider providerA = new FakeAnalysisProvider("a");
  private final FakeAnalysisProvider providerB = new FakeAnalysisProvider("b");
  private final FakeAnalysisProvider providerC = new FakeAnalysisProvider("c");

  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService providerExecutor;
  private CircuitBreakerRegistry circuitBreakers;
  private BudgetMeter budgetMeter;
  private TokenBucketRateLimiter rateLimiter;
  private Duration providerTimeout;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(AnalysisFixtures.NOW);
    meterRegistry = new SimpleMeterRegistry();
    providerExecutor = Executors.newFixedThreadPool(4);
    AnalysisGatewayMetrics metrics = new AnalysisGatewayMetrics(meterRegistry);
    circuitBreakers =
        new CircuitBreakerRegistry(new AnalysisGatewayProperties.CircuitBreaker(), clock, metrics::recordCircuitTransition);
    budgetMeter = new BudgetMeter(40_000, 200_000, BigDecimal.ZERO, clock, alert -> {}, Runnable::run);
    rateLimiter = new TokenBucketRateLimiter(100, 100);
    providerTimeout = Duration.ofSeconds(5);
  }

  @AfterEach
  void tearDown() {
    providerExecutor.shutdownNow();
  }

  @Test
  void advancesChainUntilProviderSucceedsThenServesFromCache() {
    providerA.failWith(ProviderErrorKind.RATE_LIMITED);
    providerB.respondWith("not json at all");
    AnalysisGateway gateway = gateway(providerA, providerB, providerC);
    RequestContext context = urgentContext();

    AnalysisResult first = gateway.analyze(context);

    assertThat(first.source()).isEqualTo(AnalysisSource.LIVE);
    assertThat(first.provider()).isEqualTo("c");
    assertThat(first.fallbackReason()).isNull();
    assertThat(first.cacheKey()).startsWith("llm:analysis:event_analysis_v1:");
    assertThat(first.json().actions()).allSatisfy(action -> assertThat(action.dryRun()).isTrue());
    assertThat(circuitBreakers.breaker("a").snapshot().lastFailure()).isEqualTo(ProviderErrorKind.RATE_LIMITED);
    assertThat(circuitBreakers.breaker("b").snapshot().lastFailure()).isEqualTo(ProviderErrorKind.INVALID_RESPONSE);

    AnalysisResult second = gateway.analyze(context);

    assertThat(second.source()).isEqualTo(AnalysisSource.CACHE);
    assertThat(second.provider()).isEqualTo("c");
    assertThat(second.json()).isEqualTo(first.json());
    assertThat(providerA.calls()).isEqualTo(1);
    assertThat(providerB.calls()).isEqualTo(1);
    assertThat(providerC.calls()).isEqualTo(1);
    assertThat(meterRegistry.counter("analysis.requests", "source", "cache", "reason", "none").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("analysis.provider.calls", "provider", "c", "outcome", "success").count())
        .isEqualTo(1.0);
    assertThat(budgetMeter.usage().dailyTokens()).isPositive();
  }

  @Test
  void allOpenCircuitsFallBackWithoutCallingProviders() {
    for (String name : List.of("a", "b", "c")) {
      circuitBreakers.breaker(name).recordFailure(ProviderErrorKind.QUOTA_EXHAUSTED);
    }
    AnalysisGateway gateway = gateway(providerA, providerB, providerC);

    AnalysisResult result = gateway.analyze(urgentContext());

    assertThat(result.source()).isEqualTo(AnalysisSource.FALLBACK);
    assertThat(result.fallbackReason()).isEqualTo(FallbackReason.CIRCUIT_OPEN);
    assertThat(result.provider()).isEqualTo(AnalysisResult.FALLBACK_PROVIDER);
    assertThat(providerA.calls() + providerB.calls() + providerC.calls()).isZero();
  }

  @Test
  void exhaustedChainFallsBackAndIsNotCached() {
    providerA.failWith(ProviderErrorKind.TIMEOUT);
    providerB.failWith(ProviderErrorKind.AUTH_FAILED);
    AnalysisGateway gateway = gateway(providerA, providerB);

    AnalysisResult first = gateway.analyze(urgentContext());
    AnalysisResult second = gateway.analyze(urgentContext());

    assertThat(first.fallbackReason()).isEqualTo(FallbackReason.PROVIDERS_EXHAUSTED);
    assertThat(second.source()).isEqualTo(AnalysisSource.FALLBACK);
    assertThat(providerA.calls()).isEqualTo(2);
  }

  @Test
  void fiveRateLimitedFailuresOpenTheCircuit() {
    providerA.failWith(ProviderErrorKind.RATE_LIMITED);
    AnalysisGateway gateway = gateway(providerA);

    for (int i = 0; i < 6; i++) {
      gateway.analyze(urgentContext());
    }

    assertThat(providerA.calls()).isEqualTo(5);
    assertThat(circuitBreakers.breaker("a").state()).isEqualTo(CircuitState.OPEN);
    assertThat(meterRegistry.counter("analysis.circuit.transitions", "provider", "a", "from", "closed", "to", "open").count())
        .isEqualTo(1.0);
  }

  @Test
  void quietMixSkipsLanguageModel() {
    AnalysisGateway gateway = gateway(providerA);

    AnalysisResult result = gateway.analyze(RequestContext.of(AnalysisFixtures.mix(0, 2, 50), AnalysisProfile.JSON));

    assertThat(result.fallbackReason()).isEqualTo(FallbackReason.POLICY_SKIPPED);
    assertThat(result.json().totals()).isEqualTo(52);
    assertThat(providerA.calls()).isZero();
  }

  @Test
  void rateLimiterRejectionFallsBack() {
    rateLimiter = new TokenBucketRateLimiter(0.001, 1);
    AnalysisGateway gateway = gateway(providerA);

    AnalysisResult first = gateway.analyze(RequestContext.of(AnalysisFixtures.mix(1, 0, 0), AnalysisProfile.JSON));
    AnalysisResult second = gateway.analyze(RequestContext.of(AnalysisFixtures.mix(2, 0, 0), AnalysisProfile.JSON));

    assertThat(first.source()).isEqualTo(AnalysisSource.LIVE);
    assertThat(second.fallbackReason()).isEqualTo(FallbackReason.RATE_LIMITED);
    assertThat(meterRegistry.counter("analysis.ratelimit.rejections").count()).isEqualTo(1.0);
  }

  @Test
  void rejectedBudgetChargeFallsBackAndBlocksLaterCalls() {
    budgetMeter = new BudgetMeter(40_000, 1_000, BigDecimal.ZERO, clock, alert -> {}, Runnable::run);
    providerA.respondWith(new ProviderCompletion(AnalysisFixtures.LIVE_JSON, "a-model", 1_000, 200, 1_200));
    AnalysisGateway gateway = gateway(providerA);

    AnalysisResult first = gateway.analyze(urgentContext());
    AnalysisResult second = gateway.analyze(RequestContext.of(AnalysisFixtures.mix(3, 0, 0), AnalysisProfile.JSON));

    assertThat(first.fallbackReason()).isEqualTo(FallbackReason.BUDGET_EXCEEDED);
    assertThat(second.fallbackReason()).isEqualTo(FallbackReason.BUDGET_EXCEEDED);
    assertThat(providerA.calls()).isEqualTo(1);
    assertThat(budgetMeter.usage().dailyTokens()).isZero();
    assertThat(meterRegistry.counter("analysis.budget.rejections", "metric", "daily_tokens").count()).isEqualTo(1.0);
  }

  @Test
  void slowProviderTimesOutAndChainAdvances() {
    providerTimeout = Duration.ofMillis(100);
    providerA.delay(Duration.ofSeconds(2));
    AnalysisGateway gateway = gateway(providerA, providerB);

    AnalysisResult result = gateway.analyze(urgentContext());

    assertThat(result.provider()).isEqualTo("b");
    assertThat(circuitBreakers.breaker("a").snapshot().lastFailure()).isEqualTo(ProviderErrorKind.TIMEOUT);
  }

  @Test
  void noRegisteredProvidersFallsBack() {
    AnalysisGateway gateway = gateway();

    AnalysisResult result = gateway.analyze(urgentContext());

    assertThat(result.fallbackReason()).isEqualTo(FallbackReason.NO_PROVIDERS);
  }

  @Test
  void routingMovesPreferredProviderFirst() {
    AnalysisGateway gateway =
        gateway(Map.of("incident_analysis", "c"), providerA, providerB, providerC);

    AnalysisResult result =
        gateway.analyze(new RequestContext(AnalysisFixtures.mix(1, 0, 0), AnalysisProfile.JSON, "incident_analysis"));

    assertThat(result.provider()).isEqualTo("c");
    assertThat(providerA.calls()).isZero();
  }

  @Test
  void chatProfileRendersSummaryWhenProviderSendsNone() {
    AnalysisGateway gateway = gateway(providerA);

    AnalysisResult result = gateway.analyze(RequestContext.of(AnalysisFixtures.mix(1, 1, 1), AnalysisProfile.CHAT));

    assertThat(result.chatSummary()).startsWith("3 events in last_24h");
  }

  @Test
  void concurrentIdenticalRequestsCallProviderOnce() throws Exception {
    providerA.delay(Duration.ofMillis(300));
    AnalysisGateway gateway = gateway(providerA);
    ExecutorService callers = Executors.newFixedThreadPool(6);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<AnalysisResult>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 6; i++) {
        futures.add(
            callers.submit(
                () -> {
                  start.await();
                  return gateway.analyze(urgentContext());
                }));
      }
      start.countDown();
      for (Future<AnalysisResult> future : futures) {
        assertThat(future.get(10, TimeUnit.SECONDS).provider()).isEqualTo("a");
      }
    } finally {
      callers.shutdownNow();
    }

    assertThat(providerA.calls()).isEqualTo(1);
  }

  private static RequestContext urgentContext() {
    return RequestContext.of(AnalysisFixtures.mix(1, 1, 3), AnalysisProfile.JSON);
  }

  private AnalysisGateway gateway(AnalysisProvider... providers) {
    return gateway(Map.of(), providers);
  }

  private AnalysisGateway gateway(Map<String, String> routing, AnalysisProvider... providers) {
    AnalysisGatewayProperties properties = new AnalysisGatewayProperties();
    ObjectMapper objectMapper = new ObjectMapper();
    ProviderRegistry registry = new ProviderRegistry(List.of(providers));
    ChatSummaryRenderer renderer = new ChatSummaryRenderer();
    return new AnalysisGateway(
        new AnalysisPolicyEngine(true, 2),
        new AnalysisCacheKeyFactory(objectMapper, "llm:analysis", "event_analysis_v1"),
        new AnalysisResponseCache(new InMemoryAnalysisCacheStore(100, clock), Duration.ofMinutes(5)),
        budgetMeter,
        rateLimiter,
        new ProviderChainResolver(registry, List.of("a", "b", "c"), routing),
        circuitBreakers,
        new AnalysisPromptFactory("event_analysis_v1", new EventContextCompactor(12), "last_24h"),
        new AnalysisResponseParser(objectMapper, ChatSummaryRenderer.MAX_LINES),
        renderer,
        new UsageCostEstimator(
            Map.of(), new JtokkitTokenUsageEstimator(Encodings.newLazyEncodingRegistry(), "cl100k_base", 100)),
        new FallbackSummarizer(properties.getFallback(), renderer, clock),
        providerExecutor,
        provider -> providerTimeout,
        new GenerationParams(600, 0.0),
        new AnalysisGatewayMetrics(meterRegistry),
        clock);
  }
}
