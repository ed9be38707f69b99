package com.nestwatch.backend.analysis.service;

import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Orders providers for a request. The provider routed for the request type goes first, the
 * configured chain follows. Names without a registered provider are skipped.
 */
public class ProviderChainResolver {

  private static final Logger log = LoggerFactory.getLogger(ProviderChainResolver.class);

  private final ProviderRegistry registry;
  private final List<String> chain;
  private final Map<String, String> routing;

  public ProviderChainResolver(ProviderRegistry registry, List<String> chain, Map<String, String> routing) {
    this.registry = registry;
    this.chain = List.copyOf(chain);
    this.routing = new HashMap<>();
    routing.forEach((requestType, provider) -> this.routing.put(requestType.toLowerCase(Locale.ROOT), provider));
    chain.stream()
        .filter(name -> !registry.contains(name))
        .forEach(name -> log.warn("Provider '{}' is in the analysis chain but not configured or disabled", name));
  }

  public List<AnalysisProvider> resolve(String requestType) {
    Set<String> ordered = new LinkedHashSet<>();
    String preferred = StringUtils.hasText(requestType) ? routing.get(requestType.toLowerCase(Locale.ROOT)) : null;
    if (StringUtils.hasText(preferred)) {
      ordered.add(preferred);
    }
    ordered.addAll(chain);
    List<AnalysisProvider> providers = new ArrayList<>(ordered.size());
    for (String name : ordered) {
      registry.find(name).ifPresent(providers::add);
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Resolved provider chain for request type '{}': {}",
          requestType,
          providers.stream().map(AnalysisProvider::name).toList());
    }
    return providers;
  }

  public List<String> configuredChain() {
    return chain;
  }
}
