package com.nestwatch.backend.analysis.circuit;

import com.nestwatch.backend.analysis.provider.ProviderErrorKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Failure tracker for a single provider.
 *
 * <p>Legal transitions are CLOSED to OPEN, OPEN to HALF_OPEN, HALF_OPEN to CLOSED and HALF_OPEN to
 * OPEN. The {@link #allow()} call that moves an open breaker to HALF_OPEN receives the only trial
 * permit; every other caller is rejected until the trial reports back.
 */
public class ProviderCircuitBreaker {

  private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

  private final String provider;
  private final int failureThreshold;
  private final Duration failureWindow;
  private final Duration cooldown;
  private final Set<ProviderErrorKind> tripImmediatelyOn;
  private final Clock clock;
  private final CircuitTransitionListener listener;

  private CircuitState state = CircuitState.CLOSED;
  private int consecutiveFailures;
  private Instant lastFailureAt;
  private ProviderErrorKind lastFailure;
  private Instant openedAt;
  private boolean trialInFlight;

  public ProviderCircuitBreaker(
      String provider,
      int failureThreshold,
      Duration failureWindow,
      Duration cooldown,
      Set<ProviderErrorKind> tripImmediatelyOn,
      Clock clock,
      CircuitTransitionListener listener) {
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException("failureThreshold must be positive");
    }
    this.provider = provider;
    this.failureThreshold = failureThreshold;
    this.failureWindow = failureWindow;
    this.cooldown = cooldown;
    this.tripImmediatelyOn =
        tripImmediatelyOn == null || tripImmediatelyOn.isEmpty()
            ? EnumSet.noneOf(ProviderErrorKind.class)
            : EnumSet.copyOf(tripImmediatelyOn);
    this.clock = clock;
    this.listener = listener != null ? listener : CircuitTransitionListener.noOp();
  }

  public String provider() {
    return provider;
  }

  public synchronized boolean allow() {
    return switch (state) {
      case CLOSED -> true;
      case OPEN -> tryStartTrial();
      case HALF_OPEN -> {
        if (trialInFlight) {
          yield false;
        }
        trialInFlight = true;
        yield true;
      }
    };
  }

  private boolean tryStartTrial() {
    if (clock.instant().isBefore(openedAt.plus(cooldown))) {
      return false;
    }
    transition(CircuitState.HALF_OPEN);
    trialInFlight = true;
    return true;
  }

  public synchronized void recordSuccess() {
    consecutiveFailures = 0;
    lastFailureAt = null;
    trialInFlight = false;
    if (state == CircuitState.HALF_OPEN) {
      openedAt = null;
      transition(CircuitState.CLOSED);
    }
  }

  public synchronized void recordFailure(ProviderErrorKind kind) {
    Instant now = clock.instant();
    lastFailure = kind;
    if (state == CircuitState.HALF_OPEN) {
      trialInFlight = false;
      consecutiveFailures++;
      lastFailureAt = now;
      open(now);
      return;
    }
    if (state == CircuitState.OPEN) {
      // late result of a call admitted before the breaker opened
      return;
    }
    if (lastFailureAt != null && Duration.between(lastFailureAt, now).compareTo(failureWindow) > 0) {
      consecutiveFailures = 0;
    }
    consecutiveFailures++;
    lastFailureAt = now;
    if (tripImmediatelyOn.contains(kind) || consecutiveFailures >= failureThreshold) {
      open(now);
    }
  }

  /** Returns an unused trial permit, e.g. when the caller was interrupted before the call finished. */
  public synchronized void releasePermit() {
    if (state == CircuitState.HALF_OPEN) {
      trialInFlight = false;
    }
  }

  /** Administrative reset back to CLOSED. */
  public synchronized void forceReset() {
    consecutiveFailures = 0;
    lastFailureAt = null;
    openedAt = null;
    trialInFlight = false;
    if (state != CircuitState.CLOSED) {
      log.info("Circuit for provider '{}' reset manually from {}", provider, state);
      transition(CircuitState.CLOSED);
    }
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized CircuitSnapshot snapshot() {
    Instant retryAt = openedAt != null ? openedAt.plus(cooldown) : null;
    return new CircuitSnapshot(
        provider, state, consecutiveFailures, openedAt, retryAt, lastFailure, cooldown);
  }

  private void open(Instant now) {
    openedAt = now;
    transition(CircuitState.OPEN);
    log.warn(
        "Circuit for provider '{}' opened after {} consecutive failure(s), last={}, retry at {}",
        provider,
        consecutiveFailures,
        lastFailure,
        now.plus(cooldown));
  }

  private void transition(CircuitState target) {
    CircuitState previous = state;
    state = target;
    if (target != CircuitState.OPEN) {
      log.info("Circuit for provider '{}' moved {} -> {}", provider, previous, target);
    }
    try {
      listener.onTransition(provider, previous, target);
    } catch (RuntimeException ex) {
      log.warn("Circuit transition listener failed for provider '{}'", provider, ex);
    }
  }
}
