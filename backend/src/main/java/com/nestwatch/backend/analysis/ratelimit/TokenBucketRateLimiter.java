package com.nestwatch.backend.analysis.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Non-blocking token bucket. Tokens refill lazily on every call; refill and decrement happen under
 * one lock so concurrent callers never overdraw the bucket.
 */
public class TokenBucketRateLimiter {

  private final double capacity;
  private final double refillPerSecond;
  private final LongSupplier nanoClock;
  private final ReentrantLock lock = new ReentrantLock();

  private double tokens;
  private long lastRefillNanos;

  public TokenBucketRateLimiter(double refillPerSecond, int capacity) {
    this(refillPerSecond, capacity, System::nanoTime);
  }

  public TokenBucketRateLimiter(double refillPerSecond, int capacity, LongSupplier nanoClock) {
    if (refillPerSecond <= 0) {
      throw new IllegalArgumentException("refillPerSecond must be positive");
    }
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.refillPerSecond = refillPerSecond;
    this.nanoClock = nanoClock;
    this.tokens = capacity;
    this.lastRefillNanos = nanoClock.getAsLong();
  }

  public boolean admit() {
    return admit(1);
  }

  public boolean admit(double cost) {
    if (cost <= 0) {
      throw new IllegalArgumentException("cost must be positive");
    }
    lock.lock();
    try {
      refill();
      if (tokens >= cost) {
        tokens -= cost;
        return true;
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  /** Time until a single token is available; zero when one is available now. */
  public Duration retryAfter() {
    lock.lock();
    try {
      refill();
      if (tokens >= 1) {
        return Duration.ZERO;
      }
      double missingSeconds = (1 - tokens) / refillPerSecond;
      return Duration.ofNanos((long) Math.ceil(missingSeconds * TimeUnit.SECONDS.toNanos(1)));
    } finally {
      lock.unlock();
    }
  }

  public RateLimiterSnapshot snapshot() {
    lock.lock();
    try {
      refill();
      return new RateLimiterSnapshot(tokens, capacity, refillPerSecond);
    } finally {
      lock.unlock();
    }
  }

  private void refill() {
    long now = nanoClock.getAsLong();
    long elapsed = now - lastRefillNanos;
    if (elapsed <= 0) {
      return;
    }
    double seconds = elapsed / (double) TimeUnit.SECONDS.toNanos(1);
    tokens = Math.min(capacity, tokens + seconds * refillPerSecond);
    lastRefillNanos = now;
  }

  public record RateLimiterSnapshot(double availableTokens, double capacity, double refillPerSecond) {}
}
