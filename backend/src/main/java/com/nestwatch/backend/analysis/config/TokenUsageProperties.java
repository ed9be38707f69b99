package com.nestwatch.backend.analysis.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.analysis.token-usage")
@Validated
public class TokenUsageProperties {

  /**
   * Tokenizer used when the provider configuration does not override it. Accepts {@code
   * ModelType} or {@code EncodingType} names supported by jtokkit.
   */
  private String defaultTokenizer = "cl100k_base";

  /** Number of memoized token counts kept in memory. */
  @Positive private long cacheSize = 2_000;

  /** Skips loading BPE vocabularies and approximates counts from text length. Used by tests. */
  private boolean lightweightMode = false;

  public String getDefaultTokenizer() {
    return defaultTokenizer;
  }

  public void setDefaultTokenizer(String defaultTokenizer) {
    this.defaultTokenizer = defaultTokenizer;
  }

  public long getCacheSize() {
    return cacheSize;
  }

  public void setCacheSize(long cacheSize) {
    this.cacheSize = cacheSize;
  }

  public boolean isLightweightMode() {
    return lightweightMode;
  }

  public void setLightweightMode(boolean lightweightMode) {
    this.lightweightMode = lightweightMode;
  }
}
