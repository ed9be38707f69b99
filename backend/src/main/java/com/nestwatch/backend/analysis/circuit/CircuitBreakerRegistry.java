package com.nestwatch.backend.analysis.circuit;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/** Process-wide breakers, one per provider name, created on first use. */
public class CircuitBreakerRegistry {

  private final AnalysisGatewayProperties.CircuitBreaker settings;
  private final Clock clock;
  private final CircuitTransitionListener listener;
  private final ConcurrentMap<String, ProviderCircuitBreaker> breakers = new ConcurrentHashMap<>();

  public CircuitBreakerRegistry(
      AnalysisGatewayProperties.CircuitBreaker settings,
      Clock clock,
      CircuitTransitionListener listener) {
    this.settings = settings;
    this.clock = clock;
    this.listener = listener;
  }

  public ProviderCircuitBreaker breaker(String provider) {
    Assert.isTrue(StringUtils.hasText(provider), "provider must not be blank");
    return breakers.computeIfAbsent(provider, this::create);
  }

  public Optional<ProviderCircuitBreaker> find(String provider) {
    return Optional.ofNullable(breakers.get(provider));
  }

  public List<CircuitSnapshot> snapshots() {
    return breakers.values().stream()
        .map(ProviderCircuitBreaker::snapshot)
        .sorted(Comparator.comparing(CircuitSnapshot::provider))
        .toList();
  }

  public void forceReset(String provider) {
    breaker(provider).forceReset();
  }

  private ProviderCircuitBreaker create(String provider) {
    return new ProviderCircuitBreaker(
        provider,
        settings.getFailureThreshold(),
        settings.getFailureWindow(),
        settings.getCooldown(),
        settings.getTripImmediatelyOn(),
        clock,
        listener);
  }
}
