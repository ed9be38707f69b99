package com.nestwatch.backend.analysis.service;

import com.nestwatch.backend.analysis.api.ProvidersStatusResponse;
import com.nestwatch.backend.analysis.api.UsageStatusResponse;
import com.nestwatch.backend.analysis.budget.BudgetMeter;
import com.nestwatch.backend.analysis.cache.AnalysisResponseCache;
import com.nestwatch.backend.analysis.circuit.CircuitBreakerRegistry;
import com.nestwatch.backend.analysis.circuit.CircuitSnapshot;
import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import com.nestwatch.backend.analysis.ratelimit.TokenBucketRateLimiter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/** Read models and admin operations behind the usage and provider endpoints. */
public class AnalysisStatusService {

  private static final Logger log = LoggerFactory.getLogger(AnalysisStatusService.class);

  private final BudgetMeter budgetMeter;
  private final TokenBucketRateLimiter rateLimiter;
  private final CircuitBreakerRegistry circuitBreakers;
  private final AnalysisResponseCache cache;
  private final ProviderRegistry providerRegistry;
  private final ProviderChainResolver chainResolver;

  public AnalysisStatusService(
      BudgetMeter budgetMeter,
      TokenBucketRateLimiter rateLimiter,
      CircuitBreakerRegistry circuitBreakers,
      AnalysisResponseCache cache,
      ProviderRegistry providerRegistry,
      ProviderChainResolver chainResolver) {
    this.budgetMeter = budgetMeter;
    this.rateLimiter = rateLimiter;
    this.circuitBreakers = circuitBreakers;
    this.cache = cache;
    this.providerRegistry = providerRegistry;
    this.chainResolver = chainResolver;
  }

  public UsageStatusResponse usage() {
    TokenBucketRateLimiter.RateLimiterSnapshot limiter = rateLimiter.snapshot();
    List<CircuitSnapshot> circuits =
        providerRegistry.providers().stream()
            .map(provider -> circuitBreakers.breaker(provider.name()).snapshot())
            .toList();
    return new UsageStatusResponse(
        budgetMeter.usage(),
        new UsageStatusResponse.RateLimit(
            limiter.availableTokens(),
            limiter.capacity(),
            limiter.refillPerSecond(),
            rateLimiter.retryAfter().toMillis()),
        circuits,
        cache.inFlightCount());
  }

  public ProvidersStatusResponse providers() {
    List<String> chain = chainResolver.configuredChain();
    List<ProvidersStatusResponse.ProviderStatus> statuses =
        providerRegistry.providers().stream()
            .map(
                provider ->
                    new ProvidersStatusResponse.ProviderStatus(
                        provider.name(),
                        provider.model(),
                        chain.contains(provider.name()),
                        isHealthy(provider),
                        circuitBreakers.breaker(provider.name()).state()))
            .toList();
    return new ProvidersStatusResponse(chain, statuses);
  }

  public CircuitSnapshot resetCircuit(String provider) {
    if (!providerRegistry.contains(provider)) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown provider: " + provider);
    }
    circuitBreakers.forceReset(provider);
    return circuitBreakers.breaker(provider).snapshot();
  }

  public void clearCache() {
    cache.clear();
    log.info("Analysis cache cleared");
  }

  private boolean isHealthy(AnalysisProvider provider) {
    try {
      return provider.isHealthy();
    } catch (RuntimeException ex) {
      log.warn("Health check failed for provider '{}'", provider.name(), ex);
      return false;
    }
  }
}
