package com.nestwatch.backend.analysis.config;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.nestwatch.backend.analysis.token.JtokkitTokenUsageEstimator;
import com.nestwatch.backend.analysis.token.TokenUsageEstimator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TokenUsageProperties.class)
public class TokenUsageConfiguration {

  @Bean
  public TokenUsageEstimator tokenUsageEstimator(TokenUsageProperties properties) {
    if (properties.isLightweightMode()) {
      return request ->
          request == null
              ? TokenUsageEstimator.Estimate.EMPTY
              : new TokenUsageEstimator.Estimate(
                  approximate(request.prompt()), approximate(request.completion()));
    }
    EncodingRegistry registry = Encodings.newLazyEncodingRegistry();
    return new JtokkitTokenUsageEstimator(
        registry, properties.getDefaultTokenizer(), properties.getCacheSize());
  }

  private static int approximate(String text) {
    return text != null ? JtokkitTokenUsageEstimator.approximate(text) : 0;
  }
}
