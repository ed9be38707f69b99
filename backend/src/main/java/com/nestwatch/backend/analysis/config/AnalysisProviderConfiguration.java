package com.nestwatch.backend.analysis.config;

import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import com.nestwatch.backend.analysis.provider.AnthropicAnalysisProvider;
import com.nestwatch.backend.analysis.provider.BedrockAnalysisProvider;
import com.nestwatch.backend.analysis.provider.LocalAnalysisProvider;
import com.nestwatch.backend.analysis.provider.OpenAiAnalysisProvider;
import com.nestwatch.backend.analysis.service.ProviderRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisProviderConfiguration {

  private static final Logger log = LoggerFactory.getLogger(AnalysisProviderConfiguration.class);

  @Bean
  public ProviderRegistry analysisProviderRegistry(AnalysisGatewayProperties properties) {
    Map<String, AnalysisGatewayProperties.Provider> providers = properties.getProviders();
    List<AnalysisProvider> adapters = new ArrayList<>(providers.size());
    providers.forEach(
        (providerId, providerConfig) -> {
          if (!providerConfig.isEnabled()) {
            log.info("Analysis provider '{}' is disabled", providerId);
            return;
          }
          if (providerConfig.getType() == null) {
            throw new IllegalStateException("Provider type must be configured for '" + providerId + "'");
          }
          AnalysisProvider adapter =
              switch (providerConfig.getType()) {
                case BEDROCK -> BedrockAnalysisProvider.create(providerId, providerConfig);
                case ANTHROPIC -> AnthropicAnalysisProvider.create(providerId, providerConfig);
                case OPENAI -> OpenAiAnalysisProvider.create(providerId, providerConfig);
                case LOCAL -> LocalAnalysisProvider.create(providerId, providerConfig);
              };
          log.info(
              "Registered analysis provider '{}' ({}, model={})",
              providerId,
              providerConfig.getType(),
              providerConfig.getModel());
          adapters.add(adapter);
        });
    if (adapters.isEmpty()) {
      log.warn("No analysis providers enabled, all analyses will use the fallback summarizer");
    }
    return new ProviderRegistry(adapters);
  }
}
