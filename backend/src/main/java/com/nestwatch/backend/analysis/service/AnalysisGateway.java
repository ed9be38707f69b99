package com.nestwatch.backend.analysis.service;

import com.nestwatch.backend.analysis.api.AnalysisProfile;
import com.nestwatch.backend.analysis.api.AnalysisResult;
import com.nestwatch.backend.analysis.api.FallbackReason;
import com.nestwatch.backend.analysis.api.RequestContext;
import com.nestwatch.backend.analysis.budget.BudgetMeter;
import com.nestwatch.backend.analysis.cache.AnalysisCacheKeyFactory;
import com.nestwatch.backend.analysis.cache.AnalysisResponseCache;
import com.nestwatch.backend.analysis.circuit.CircuitBreakerRegistry;
import com.nestwatch.backend.analysis.circuit.ProviderCircuitBreaker;
import com.nestwatch.backend.analysis.fallback.FallbackSummarizer;
import com.nestwatch.backend.analysis.policy.AnalysisPolicyEngine;
import com.nestwatch.backend.analysis.policy.PriorityMix;
import com.nestwatch.backend.analysis.prompt.AnalysisPromptFactory;
import com.nestwatch.backend.analysis.prompt.AnalysisResponseParser;
import com.nestwatch.backend.analysis.prompt.ChatSummaryRenderer;
import com.nestwatch.backend.analysis.prompt.InvalidAnalysisResponseException;
import com.nestwatch.backend.analysis.provider.AnalysisProvider;
import com.nestwatch.backend.analysis.provider.ProviderErrorClassifier;
import com.nestwatch.backend.analysis.provider.ProviderErrorKind;
import com.nestwatch.backend.analysis.provider.ProviderException;
import com.nestwatch.backend.analysis.provider.model.AnalysisPrompt;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import com.nestwatch.backend.analysis.provider.model.ProviderCompletion;
import com.nestwatch.backend.analysis.provider.model.UsageCostEstimate;
import com.nestwatch.backend.analysis.ratelimit.TokenBucketRateLimiter;
import com.nestwatch.backend.analysis.telemetry.AnalysisGatewayMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for event analysis. Composes policy, cache, budget, rate limiting, circuit breaking
 * and the provider chain, and degrades to the rule-based summarizer whenever no live answer can be
 * obtained. Callers always receive a well-formed result.
 */
public class AnalysisGateway {

  private static final Logger log = LoggerFactory.getLogger(AnalysisGateway.class);

  private final AnalysisPolicyEngine policyEngine;
  private final AnalysisCacheKeyFactory cacheKeyFactory;
  private final AnalysisResponseCache cache;
  private final BudgetMeter budgetMeter;
  private final TokenBucketRateLimiter rateLimiter;
  private final ProviderChainResolver chainResolver;
  private final CircuitBreakerRegistry circuitBreakers;
  private final AnalysisPromptFactory promptFactory;
  private final AnalysisResponseParser responseParser;
  private final ChatSummaryRenderer summaryRenderer;
  private final UsageCostEstimator usageCostEstimator;
  private final FallbackSummarizer fallbackSummarizer;
  private final ExecutorService providerExecutor;
  private final Function<String, Duration> providerTimeouts;
  private final GenerationParams generationParams;
  private final AnalysisGatewayMetrics metrics;
  private final Clock clock;

  public AnalysisGateway(
      AnalysisPolicyEngine policyEngine,
      AnalysisCacheKeyFactory cacheKeyFactory,
      AnalysisResponseCache cache,
      BudgetMeter budgetMeter,
      TokenBucketRateLimiter rateLimiter,
      ProviderChainResolver chainResolver,
      CircuitBreakerRegistry circuitBreakers,
      AnalysisPromptFactory promptFactory,
      AnalysisResponseParser responseParser,
      ChatSummaryRenderer summaryRenderer,
      UsageCostEstimator usageCostEstimator,
      FallbackSummarizer fallbackSummarizer,
      ExecutorService providerExecutor,
      Function<String, Duration> providerTimeouts,
      GenerationParams generationParams,
      AnalysisGatewayMetrics metrics,
      Clock clock) {
    this.policyEngine = policyEngine;
    this.cacheKeyFactory = cacheKeyFactory;
    this.cache = cache;
    this.budgetMeter = budgetMeter;
    this.rateLimiter = rateLimiter;
    this.chainResolver = chainResolver;
    this.circuitBreakers = circuitBreakers;
    this.promptFactory = promptFactory;
    this.responseParser = responseParser;
    this.summaryRenderer = summaryRenderer;
    this.usageCostEstimator = usageCostEstimator;
    this.fallbackSummarizer = fallbackSummarizer;
    this.providerExecutor = providerExecutor;
    this.providerTimeouts = providerTimeouts;
    this.generationParams = generationParams;
    this.metrics = metrics;
    this.clock = clock;
  }

  public AnalysisResult analyze(RequestContext context) {
    AnalysisResult result;
    PriorityMix mix = PriorityMix.of(context.events());
    if (policyEngine.shouldSkipLlm(mix)) {
      log.info("Skipping live analysis for quiet event mix P1={}, P2={}, P3={}", mix.p1(), mix.p2(), mix.p3());
      result = fallback(context, FallbackReason.POLICY_SKIPPED);
    } else {
      String key = cacheKeyFactory.keyFor(context);
      result = cache.getOrCompute(key, () -> resolve(context, key));
    }
    metrics.recordResult(result);
    return result;
  }

  private AnalysisResult resolve(RequestContext context, String cacheKey) {
    GatewayOutcome outcome = computeLive(context, cacheKey);
    if (outcome instanceof GatewayOutcome.Ok ok) {
      return ok.result();
    }
    if (outcome instanceof GatewayOutcome.Skip skip) {
      return fallback(context, skip.reason());
    }
    GatewayOutcome.Fail fail = (GatewayOutcome.Fail) outcome;
    log.warn(
        "All analysis providers failed, last error from '{}': {}",
        fail.error().provider(),
        fail.error().kind());
    return fallback(context, FallbackReason.PROVIDERS_EXHAUSTED);
  }

  GatewayOutcome computeLive(RequestContext context, String cacheKey) {
    if (budgetMeter.isExhausted()) {
      return GatewayOutcome.skip(FallbackReason.BUDGET_EXCEEDED);
    }
    if (!rateLimiter.admit()) {
      metrics.recordRateLimited();
      return GatewayOutcome.skip(FallbackReason.RATE_LIMITED);
    }
    List<AnalysisProvider> chain = chainResolver.resolve(context.requestType());
    if (chain.isEmpty()) {
      return GatewayOutcome.skip(FallbackReason.NO_PROVIDERS);
    }

    AnalysisPrompt prompt = promptFactory.build(context);
    ProviderException lastError = null;
    for (AnalysisProvider provider : chain) {
      ProviderCircuitBreaker breaker = circuitBreakers.breaker(provider.name());
      if (!breaker.allow()) {
        log.debug("Circuit for provider '{}' is {}, skipping", provider.name(), breaker.state());
        continue;
      }
      long start = System.nanoTime();
      ProviderCompletion completion;
      AnalysisResponseParser.ParsedAnalysis parsed;
      try {
        completion = invoke(provider, prompt);
        parsed = parse(provider, completion, context.profile());
      } catch (ProviderException ex) {
        breaker.recordFailure(ex.kind());
        metrics.recordProviderCall(provider.name(), ex.kind().name().toLowerCase(Locale.ROOT), System.nanoTime() - start);
        log.warn("Analysis provider '{}' failed with {}: {}", provider.name(), ex.kind(), ex.getMessage());
        lastError = ex;
        continue;
      } catch (CancellationException ex) {
        breaker.releasePermit();
        throw ex;
      }
      breaker.recordSuccess();
      metrics.recordProviderCall(provider.name(), "success", System.nanoTime() - start);

      UsageCostEstimate usage = usageCostEstimator.estimate(provider.name(), prompt, completion);
      metrics.recordUsage(provider.name(), usage);
      BudgetMeter.ChargeResult charge = budgetMeter.charge(usage.totalTokens(), usage.costUsd());
      if (!charge.withinLimits()) {
        metrics.recordBudgetRejection(charge.limitingMetric());
        return GatewayOutcome.skip(FallbackReason.BUDGET_EXCEEDED);
      }

      String chatSummary = null;
      if (context.profile() == AnalysisProfile.CHAT) {
        chatSummary =
            parsed.chatSummary() != null ? parsed.chatSummary() : summaryRenderer.render(parsed.payload());
      }
      log.info(
          "Live analysis from '{}' ({} tokens, {} USD, budget {}% used)",
          provider.name(),
          usage.totalTokens(),
          usage.costUsd().toPlainString(),
          charge.pctUsed());
      return GatewayOutcome.ok(
          AnalysisResult.live(parsed.payload(), chatSummary, provider.name(), cacheKey, clock.instant()));
    }
    if (lastError == null) {
      return GatewayOutcome.skip(FallbackReason.CIRCUIT_OPEN);
    }
    return GatewayOutcome.fail(lastError);
  }

  private ProviderCompletion invoke(AnalysisProvider provider, AnalysisPrompt prompt) {
    Duration timeout = providerTimeouts.apply(provider.name());
    Future<ProviderCompletion> future;
    try {
      future = providerExecutor.submit(() -> provider.generate(prompt, generationParams));
    } catch (RejectedExecutionException ex) {
      throw new ProviderException(provider.name(), ProviderErrorKind.UNKNOWN, "Provider executor rejected the call", ex);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw ProviderException.timeout(provider.name(), timeout.toMillis());
    } catch (ExecutionException ex) {
      throw ProviderErrorClassifier.toProviderException(provider.name(), ex.getCause());
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      CancellationException cancellation =
          new CancellationException("Interrupted while waiting for provider '" + provider.name() + "'");
      cancellation.initCause(ex);
      throw cancellation;
    }
  }

  private AnalysisResponseParser.ParsedAnalysis parse(
      AnalysisProvider provider, ProviderCompletion completion, AnalysisProfile profile) {
    try {
      return responseParser.parse(completion.text(), profile);
    } catch (InvalidAnalysisResponseException ex) {
      throw ProviderException.invalidResponse(provider.name(), ex.getMessage());
    }
  }

  private AnalysisResult fallback(RequestContext context, FallbackReason reason) {
    log.info("Using fallback analysis for {} events (reason={})", context.events().size(), reason.value());
    return fallbackSummarizer.summarize(context.events(), context.profile()).withFallbackReason(reason);
  }
}
