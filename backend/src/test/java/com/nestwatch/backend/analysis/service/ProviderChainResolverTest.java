package com.nestwatch.backend.analysis.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import com.nestwatch.backend.analysis.support.FakeAnalysisProvider;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderChainResolverTest {

  private final ProviderRegistry registry =
      new ProviderRegistry(
          List.of(
              new FakeAnalysisProvider("bedrock"),
              new FakeAnalysisProvider("anthropic"),
              new FakeAnalysisProvider("nemo_local")));

  @Test
  void keepsConfiguredOrderForUnroutedRequestTypes() {
    ProviderChainResolver resolver =
        new ProviderChainResolver(registry, List.of("bedrock", "anthropic", "nemo_local"), Map.of());

    assertThat(names(resolver.resolve("general"))).containsExactly("bedrock", "anthropic", "nemo_local");
  }

  @Test
  void routedProviderGoesFirstWithoutDuplicates() {
    ProviderChainResolver resolver =
        new ProviderChainResolver(
            registry, List.of("bedrock", "anthropic", "nemo_local"), Map.of("sensitive", "nemo_local"));

    assertThat(names(resolver.resolve("SENSITIVE"))).containsExactly("nemo_local", "bedrock", "anthropic");
  }

  @Test
  void skipsNamesWithoutRegisteredProvider() {
    ProviderChainResolver resolver =
        new ProviderChainResolver(
            registry, List.of("bedrock", "openai", "anthropic"), Map.of("batch", "missing"));

    assertThat(names(resolver.resolve("batch"))).containsExactly("bedrock", "anthropic");
    assertThat(resolver.configuredChain()).containsExactly("bedrock", "openai", "anthropic");
  }

  @Test
  void emptyRegistryResolvesEmptyChain() {
    ProviderChainResolver resolver =
        new ProviderChainResolver(new ProviderRegistry(List.of()), List.of("bedrock"), Map.of());

    assertThat(resolver.resolve(null)).isEmpty();
  }

  private static List<String> names(List<AnalysisProvider> providers) {
    return providers.stream().map(AnalysisProvider::name).toList();
  }
}
