package com.nestwatch.backend.analysis.provider;

import com.nestwatch.backend.analysis.provider.model.AnalysisPrompt;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import com.nestwatch.backend.analysis.provider.model.ProviderCompletion;

/**
 * Capability wrapper around one external language-model vendor.
 *
 * <p>Implementations must translate every vendor failure into a {@link ProviderException}; the
 * gateway relies on the {@link ProviderErrorKind} to drive its circuit breakers.
 */
public interface AnalysisProvider {

  /** Identifier used in the provider chain, breaker registry and metrics. */
  String name();

  ProviderCompletion generate(AnalysisPrompt prompt, GenerationParams params);

  /** Cheap configuration-level check, no network round trip. */
  boolean isHealthy();

  default String model() {
    return null;
  }
}
