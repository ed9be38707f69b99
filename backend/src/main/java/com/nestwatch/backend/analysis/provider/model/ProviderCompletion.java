package com.nestwatch.backend.analysis.provider.model;

/**
 * Raw provider answer. Token counts are the vendor's usage metadata and are {@code null} when the
 * vendor reported none.
 */
public record ProviderCompletion(
    String text, String model, Integer promptTokens, Integer completionTokens, Integer totalTokens) {

  public static ProviderCompletion of(String text) {
    return new ProviderCompletion(text, null, null, null, null);
  }

  public boolean hasNativeUsage() {
    return promptTokens != null || completionTokens != null || totalTokens != null;
  }
}
