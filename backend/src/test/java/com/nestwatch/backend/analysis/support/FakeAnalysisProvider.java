package com.nestwatch.backend.analysis.support;

import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import com.nestwatch.backend.analysis.provider.ProviderErrorKind;
import com.nestwatch.backend.analysis.provider.ProviderException;
import com.nestwatch.backend.analysis.provider.model.AnalysisPrompt;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import com.nestwatch.backend.analysis.provider.model.ProviderCompletion;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Scriptable provider for gateway tests. */
public class FakeAnalysisProvider implements AnalysisProvider {

  private final String name;
  private final AtomicInteger calls = new AtomicInteger();
  private volatile Supplier<ProviderCompletion> behaviour;
  private volatile Duration delay = Duration.ZERO;
  private volatile boolean healthy = true;

  public FakeAnalysisProvider(String name) {
    this.name = name;
    this.behaviour = () -> ProviderCompletion.of(AnalysisFixtures.LIVE_JSON);
  }

  public FakeAnalysisProvider respondWith(String text) {
    this.behaviour = () -> ProviderCompletion.of(text);
    return this;
  }

  public FakeAnalysisProvider respondWith(ProviderCompletion completion) {
    this.behaviour = () -> completion;
    return this;
  }

  public FakeAnalysisProvider failWith(ProviderErrorKind kind) {
    this.behaviour =
        () -> {
          throw new ProviderException(name, kind, name + " failed with " + kind);
        };
    return this;
  }

  public FakeAnalysisProvider delay(Duration delay) {
    this.delay = delay;
    return this;
  }

  public FakeAnalysisProvider healthy(boolean healthy) {
    this.healthy = healthy;
    return this;
  }

  public int calls() {
    return calls.get();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String model() {
    return name + "-model";
  }

  @Override
  public ProviderCompletion generate(AnalysisPrompt prompt, GenerationParams params) {
    calls.incrementAndGet();
    if (!delay.isZero()) {
      try {
        Thread.sleep(delay.toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new ProviderException(name, ProviderErrorKind.TIMEOUT, "interrupted");
      }
    }
    return behaviour.get();
  }

  @Override
  public boolean isHealthy() {
    return healthy;
  }
}
