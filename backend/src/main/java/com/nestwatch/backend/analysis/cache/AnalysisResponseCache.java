package com.nestwatch.backend.analysis.cache;

import com.nestwatch.backend.analysis.api.AnalysisResult;
import com.nestwatch.backend.analysis.api.AnalysisSource;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache of completed analyses with at most one in-flight computation per key.
 *
 * <p>Deduplication happens in-process above the store, so the contract holds for every {@link
 * AnalysisCacheStore}. Only {@link AnalysisSource#LIVE} results are stored. Waiters block until the
 * leader finishes; the leader is bounded by the provider timeouts. When the leader is cancelled the
 * waiters retry and one of them takes over.
 */
public class AnalysisResponseCache {

  private static final Logger log = LoggerFactory.getLogger(AnalysisResponseCache.class);

  private final AnalysisCacheStore store;
  private final Duration defaultTtl;
  private final ConcurrentMap<String, CompletableFuture<AnalysisResult>> inFlight = new ConcurrentHashMap<>();

  public AnalysisResponseCache(AnalysisCacheStore store, Duration defaultTtl) {
    this.store = store;
    this.defaultTtl = defaultTtl;
  }

  public AnalysisResult getOrCompute(String key, Supplier<AnalysisResult> computeFn) {
    return getOrCompute(key, computeFn, defaultTtl);
  }

  public AnalysisResult getOrCompute(String key, Supplier<AnalysisResult> computeFn, Duration ttl) {
    while (true) {
      Optional<AnalysisResult> cached = store.get(key);
      if (cached.isPresent()) {
        log.debug("Analysis cache hit for {}", key);
        return cached.get().fromCache();
      }

      CompletableFuture<AnalysisResult> ours = new CompletableFuture<>();
      CompletableFuture<AnalysisResult> existing = inFlight.putIfAbsent(key, ours);
      if (existing == null) {
        return lead(key, ours, computeFn, ttl);
      }
      AnalysisResult joined = await(key, existing);
      if (joined != null) {
        return joined;
      }
      log.debug("In-flight analysis for {} was cancelled, retrying", key);
    }
  }

  private AnalysisResult lead(
      String key, CompletableFuture<AnalysisResult> ours, Supplier<AnalysisResult> computeFn, Duration ttl) {
    try {
      AnalysisResult result;
      // another leader may have finished between the store lookup and our registration
      Optional<AnalysisResult> raced = store.get(key);
      if (raced.isPresent()) {
        result = raced.get().fromCache();
      } else {
        result = computeFn.get();
        if (result != null && result.source() == AnalysisSource.LIVE) {
          store.put(key, result, ttl);
        }
      }
      inFlight.remove(key, ours);
      ours.complete(result);
      return result;
    } catch (CancellationException ex) {
      // null tells waiters to retry; the cancellation belongs to this caller only
      inFlight.remove(key, ours);
      ours.complete(null);
      throw ex;
    } catch (RuntimeException | Error ex) {
      inFlight.remove(key, ours);
      ours.completeExceptionally(ex);
      throw ex;
    }
  }

  private AnalysisResult await(String key, CompletableFuture<AnalysisResult> leader) {
    log.debug("Joining in-flight analysis for {}", key);
    try {
      return leader.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("In-flight analysis failed", cause);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      CancellationException cancellation = new CancellationException("Interrupted while waiting for analysis " + key);
      cancellation.initCause(ex);
      throw cancellation;
    }
  }

  public void invalidate(String key) {
    store.invalidate(key);
  }

  public void clear() {
    store.clear();
  }

  public int inFlightCount() {
    return inFlight.size();
  }
}
