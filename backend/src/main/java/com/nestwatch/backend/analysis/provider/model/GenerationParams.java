package com.nestwatch.backend.analysis.provider.model;

public record GenerationParams(int maxTokens, double temperature) {

  public GenerationParams {
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive");
    }
    if (temperature < 0) {
      throw new IllegalArgumentException("temperature must not be negative");
    }
  }

  public GenerationParams withOverrides(Integer maxTokensOverride, Double temperatureOverride) {
    return new GenerationParams(
        maxTokensOverride != null ? Math.min(maxTokensOverride, maxTokens) : maxTokens,
        temperatureOverride != null ? temperatureOverride : temperature);
  }
}
