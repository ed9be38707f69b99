package com.nestwatch.backend.analysis.policy;

/**
 * Decides whether an event mix is quiet enough to be summarized without a language model. Pure
 * function of the counts.
 */
public class AnalysisPolicyEngine {

  private final boolean enabled;
  private final int maxP2ForSkip;

  public AnalysisPolicyEngine(boolean enabled, int maxP2ForSkip) {
    if (maxP2ForSkip < 0) {
      throw new IllegalArgumentException("maxP2ForSkip must not be negative");
    }
    this.enabled = enabled;
    this.maxP2ForSkip = maxP2ForSkip;
  }

  public boolean shouldSkipLlm(PriorityMix mix) {
    if (!enabled || mix == null) {
      return false;
    }
    return mix.p1() == 0 && mix.p2() <= maxP2ForSkip;
  }
}
