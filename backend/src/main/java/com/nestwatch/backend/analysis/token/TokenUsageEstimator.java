package com.nestwatch.backend.analysis.token;

import org.springframework.util.StringUtils;

public interface TokenUsageEstimator {

  Estimate estimate(EstimateRequest request);

  record EstimateRequest(String providerId, String tokenizer, String prompt, String completion) {

    public EstimateRequest {
      tokenizer = StringUtils.hasText(tokenizer) ? tokenizer.trim() : null;
      prompt = StringUtils.hasText(prompt) ? prompt : null;
      completion = StringUtils.hasText(completion) ? completion : null;
    }
  }

  record Estimate(int promptTokens, int completionTokens) {

    public static final Estimate EMPTY = new Estimate(0, 0);

    public int totalTokens() {
      return promptTokens + completionTokens;
    }

    public boolean hasUsage() {
      return totalTokens() > 0;
    }
  }
}
