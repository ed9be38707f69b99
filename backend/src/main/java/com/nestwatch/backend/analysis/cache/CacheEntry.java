package com.nestwatch.backend.analysis.cache;

import com.nestwatch.backend.analysis.api.AnalysisResult;
import java.time.Duration;
import java.time.Instant;

public record CacheEntry(String key, AnalysisResult value, Instant createdAt, Duration ttl) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(createdAt.plus(ttl));
  }
}
