package com.nestwatch.backend.analysis.service;

import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ProviderRegistry {

  private final Map<String, AnalysisProvider> providersByName;

  public ProviderRegistry(List<AnalysisProvider> providers) {
    Map<String, AnalysisProvider> byName = new LinkedHashMap<>();
    for (AnalysisProvider provider : providers) {
      if (byName.putIfAbsent(provider.name(), provider) != null) {
        throw new IllegalStateException("Duplicate analysis provider '" + provider.name() + "'");
      }
    }
    this.providersByName = Collections.unmodifiableMap(byName);
  }

  public Optional<AnalysisProvider> find(String name) {
    return Optional.ofNullable(providersByName.get(name));
  }

  public boolean contains(String name) {
    return providersByName.containsKey(name);
  }

  public Collection<AnalysisProvider> providers() {
    return providersByName.values();
  }
}
