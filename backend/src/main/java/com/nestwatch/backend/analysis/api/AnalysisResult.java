package com.nestwatch.backend.analysis.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "Analysis returned to dashboard and chat callers")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResult(
    AnalysisPayload json,
    String chatSummary,
    String provider,
    AnalysisSource source,
    FallbackReason fallbackReason,
    String cacheKey,
    Instant generatedAt) {

  public static final String FALLBACK_PROVIDER = "fallback";

  public AnalysisResult {
    if (json == null) {
      throw new IllegalArgumentException("json payload must not be null");
    }
    if (source == null) {
      throw new IllegalArgumentException("source must not be null");
    }
    if (source == AnalysisSource.FALLBACK && !FALLBACK_PROVIDER.equals(provider)) {
      throw new IllegalArgumentException("Fallback results must use the fallback provider label");
    }
    if (source != AnalysisSource.FALLBACK && fallbackReason != null) {
      throw new IllegalArgumentException("Only fallback results carry a fallback reason");
    }
  }

  public static AnalysisResult live(
      AnalysisPayload json, String chatSummary, String provider, String cacheKey, Instant generatedAt) {
    return new AnalysisResult(json, chatSummary, provider, AnalysisSource.LIVE, null, cacheKey, generatedAt);
  }

  public static AnalysisResult fallback(
      AnalysisPayload json, String chatSummary, Instant generatedAt) {
    return new AnalysisResult(
        json, chatSummary, FALLBACK_PROVIDER, AnalysisSource.FALLBACK, null, null, generatedAt);
  }

  public AnalysisResult fromCache() {
    return new AnalysisResult(
        json, chatSummary, provider, AnalysisSource.CACHE, null, cacheKey, generatedAt);
  }

  public AnalysisResult withFallbackReason(FallbackReason reason) {
    return new AnalysisResult(json, chatSummary, provider, source, reason, cacheKey, generatedAt);
  }

  public AnalysisResult withCacheKey(String key) {
    return new AnalysisResult(json, chatSummary, provider, source, fallbackReason, key, generatedAt);
  }
}
