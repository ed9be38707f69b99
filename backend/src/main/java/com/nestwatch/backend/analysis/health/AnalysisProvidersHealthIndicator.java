package com.nestwatch.backend.analysis.health;

import com.nestwatch.backend.analysis.circuit.CircuitBreakerRegistry;
import com.nestwatch.backend.analysis.circuit.CircuitState;
import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import com.nestwatch.backend.analysis.service.ProviderRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

/**
 * UP while at least one provider is configured and accepting calls. With none available the gateway
 * still answers through the fallback summarizer, so the state is reported as {@code DEGRADED}
 * rather than DOWN.
 */
public class AnalysisProvidersHealthIndicator implements HealthIndicator {

  static final Status DEGRADED = new Status("DEGRADED", "Analysis served by the fallback summarizer only");

  private final ProviderRegistry providerRegistry;
  private final CircuitBreakerRegistry circuitBreakers;

  public AnalysisProvidersHealthIndicator(
      ProviderRegistry providerRegistry, CircuitBreakerRegistry circuitBreakers) {
    this.providerRegistry = providerRegistry;
    this.circuitBreakers = circuitBreakers;
  }

  @Override
  public Health health() {
    if (providerRegistry.providers().isEmpty()) {
      return Health.unknown().withDetail("status", "no-providers").build();
    }
    Map<String, String> details = new LinkedHashMap<>();
    int available = 0;
    for (AnalysisProvider provider : providerRegistry.providers()) {
      CircuitState state = circuitBreakers.breaker(provider.name()).state();
      boolean healthy = provider.isHealthy();
      details.put(provider.name(), (healthy ? "configured" : "misconfigured") + "/" + state.jsonValue());
      if (healthy && state != CircuitState.OPEN) {
        available++;
      }
    }
    Health.Builder builder = available > 0 ? Health.up() : Health.status(DEGRADED);
    return builder.withDetail("available", available).withDetail("providers", details).build();
  }
}
