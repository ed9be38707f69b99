package com.nestwatch.backend.analysis.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.nestwatch.backend.analysis.api.AnalysisResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public class InMemoryAnalysisCacheStore implements AnalysisCacheStore {

  private final Cache<String, CacheEntry> entries;
  private final Clock clock;

  public InMemoryAnalysisCacheStore(long maximumSize, Clock clock) {
    this.clock = clock;
    this.entries =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(clockTicker(clock))
            .expireAfter(new EntryTtlExpiry())
            .build();
  }

  @Override
  public Optional<AnalysisResult> get(String key) {
    CacheEntry entry = entries.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.asMap().remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void put(String key, AnalysisResult value, Duration ttl) {
    entries.put(key, new CacheEntry(key, value, clock.instant(), ttl));
  }

  @Override
  public void invalidate(String key) {
    entries.invalidate(key);
  }

  @Override
  public void clear() {
    entries.invalidateAll();
  }

  long estimatedSize() {
    entries.cleanUp();
    return entries.estimatedSize();
  }

  private static Ticker clockTicker(Clock clock) {
    return () -> {
      Instant now = clock.instant();
      return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    };
  }

  private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {

    @Override
    public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
