package com.nestwatch.backend.analysis.cache;

import com.nestwatch.backend.analysis.api.AnalysisResult;
import java.time.Duration;
import java.util.Optional;

/** Backing storage for completed analyses. Implementations must treat their own failures as misses. */
public interface AnalysisCacheStore {

  Optional<AnalysisResult> get(String key);

  void put(String key, AnalysisResult value, Duration ttl);

  void invalidate(String key);

  void clear();
}
