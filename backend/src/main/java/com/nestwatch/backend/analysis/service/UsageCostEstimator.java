package com.nestwatch.backend.analysis.service;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.provider.model.AnalysisPrompt;
import com.nestwatch.backend.analysis.provider.model.ProviderCompletion;
import com.nestwatch.backend.analysis.provider.model.UsageCostEstimate;
import com.nestwatch.backend.analysis.provider.model.UsageSource;
import com.nestwatch.backend.analysis.token.TokenUsageEstimator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Token usage and USD cost of one provider call. Vendor usage metadata wins; otherwise tokens are
 * estimated locally with the provider's tokenizer.
 */
public class UsageCostEstimator {

  private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1_000);
  private static final int COST_SCALE = 8;

  private final Map<String, AnalysisGatewayProperties.Provider> providers;
  private final TokenUsageEstimator tokenUsageEstimator;

  public UsageCostEstimator(
      Map<String, AnalysisGatewayProperties.Provider> providers, TokenUsageEstimator tokenUsageEstimator) {
    this.providers = providers;
    this.tokenUsageEstimator = tokenUsageEstimator;
  }

  public UsageCostEstimate estimate(String providerId, AnalysisPrompt prompt, ProviderCompletion completion) {
    AnalysisGatewayProperties.Provider config = providers.get(providerId);
    int promptTokens;
    int completionTokens;
    UsageSource usageSource;
    if (completion.hasNativeUsage()) {
      promptTokens = valueOrZero(completion.promptTokens());
      completionTokens = valueOrZero(completion.completionTokens());
      if (promptTokens == 0 && completionTokens == 0) {
        promptTokens = valueOrZero(completion.totalTokens());
      }
      usageSource = UsageSource.NATIVE;
    } else {
      TokenUsageEstimator.Estimate estimate =
          tokenUsageEstimator.estimate(
              new TokenUsageEstimator.EstimateRequest(
                  providerId,
                  config != null ? config.getTokenizer() : null,
                  prompt.fullText(),
                  completion.text()));
      promptTokens = estimate.promptTokens();
      completionTokens = estimate.completionTokens();
      usageSource = estimate.hasUsage() ? UsageSource.ESTIMATED : UsageSource.UNKNOWN;
    }

    AnalysisGatewayProperties.Pricing pricing = config != null ? config.getPricing() : null;
    BigDecimal cost =
        computeCost(promptTokens, pricing != null ? pricing.getInputPer1KTokens() : null)
            .add(computeCost(completionTokens, pricing != null ? pricing.getOutputPer1KTokens() : null))
            .setScale(COST_SCALE, RoundingMode.HALF_UP);
    return new UsageCostEstimate(promptTokens, completionTokens, cost, usageSource);
  }

  private static int valueOrZero(Integer value) {
    return value != null ? value : 0;
  }

  private static BigDecimal computeCost(int tokens, BigDecimal ratePer1KTokens) {
    if (ratePer1KTokens == null || tokens == 0) {
      return BigDecimal.ZERO;
    }
    return ratePer1KTokens
        .multiply(BigDecimal.valueOf(tokens))
        .divide(ONE_THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
  }
}
