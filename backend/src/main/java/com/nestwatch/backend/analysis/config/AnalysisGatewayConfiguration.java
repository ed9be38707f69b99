package com.nestwatch.backend.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nestwatch.backend.analysis.budget.BudgetAlertNotifier;
import com.nestwatch.backend.analysis.budget.BudgetMeter;
import com.nestwatch.backend.analysis.budget.LoggingBudgetAlertNotifier;
import com.nestwatch.backend.analysis.budget.WebhookBudgetAlertNotifier;
import com.nestwatch.backend.analysis.cache.AnalysisCacheKeyFactory;
import com.nestwatch.backend.analysis.cache.AnalysisCacheStore;
import com.nestwatch.backend.analysis.cache.AnalysisResponseCache;
import com.nestwatch.backend.analysis.cache.InMemoryAnalysisCacheStore;
import com.nestwatch.backend.analysis.cache.RedisAnalysisCacheStore;
import com.nestwatch.backend.analysis.circuit.CircuitBreakerRegistry;
import com.nestwatch.backend.analysis.fallback.FallbackSummarizer;
import com.nestwatch.backend.analysis.health.AnalysisProvidersHealthIndicator;
import com.nestwatch.backend.analysis.policy.AnalysisPolicyEngine;
import com.nestwatch.backend.analysis.prompt.AnalysisPromptFactory;
import com.nestwatch.backend.analysis.prompt.AnalysisResponseParser;
import com.nestwatch.backend.analysis.prompt.ChatSummaryRenderer;
import com.nestwatch.backend.analysis.prompt.EventContextCompactor;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import com.nestwatch.backend.analysis.ratelimit.TokenBucketRateLimiter;
import com.nestwatch.backend.analysis.service.AnalysisGateway;
import com.nestwatch.backend.analysis.service.AnalysisStatusService;
import com.nestwatch.backend.analysis.service.ProviderChainResolver;
import com.nestwatch.backend.analysis.service.ProviderRegistry;
import com.nestwatch.backend.analysis.service.UsageCostEstimator;
import com.nestwatch.backend.analysis.telemetry.AnalysisGatewayMetrics;
import com.nestwatch.backend.analysis.token.TokenUsageEstimator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Configuration
@EnableConfigurationProperties(AnalysisGatewayProperties.class)
public class AnalysisGatewayConfiguration {

  private static final Logger log = LoggerFactory.getLogger(AnalysisGatewayConfiguration.class);
  private static final Duration DEFAULT_PROVIDER_TIMEOUT = Duration.ofSeconds(30);

  @Bean
  public Clock analysisClock() {
    return Clock.systemUTC();
  }

  @Bean(name = "analysisProviderExecutor", destroyMethod = "shutdownNow")
  public ExecutorService analysisProviderExecutor(AnalysisGatewayProperties properties) {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("analysis-provider-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };
    return Executors.newFixedThreadPool(properties.getProviderCallConcurrency(), threadFactory);
  }

  @Bean(name = "budgetAlertExecutor", destroyMethod = "shutdown")
  public ExecutorService budgetAlertExecutor() {
    return Executors.newSingleThreadExecutor(
        runnable -> {
          Thread thread = new Thread(runnable, "budget-alerts");
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  public AnalysisGatewayMetrics analysisGatewayMetrics(MeterRegistry meterRegistry) {
    return new AnalysisGatewayMetrics(meterRegistry);
  }

  @Bean
  public AnalysisPolicyEngine analysisPolicyEngine(AnalysisGatewayProperties properties) {
    AnalysisGatewayProperties.Policy policy = properties.getPolicy();
    return new AnalysisPolicyEngine(policy.isEnabled(), policy.getMaxP2ForSkip());
  }

  @Bean
  public TokenBucketRateLimiter analysisRateLimiter(AnalysisGatewayProperties properties) {
    AnalysisGatewayProperties.RateLimit rateLimit = properties.getRateLimit();
    return new TokenBucketRateLimiter(rateLimit.getRequestsPerSecond(), rateLimit.getBurst());
  }

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry(
      AnalysisGatewayProperties properties, Clock analysisClock, AnalysisGatewayMetrics metrics) {
    return new CircuitBreakerRegistry(
        properties.getCircuitBreaker(), analysisClock, metrics::recordCircuitTransition);
  }

  @Bean
  public BudgetAlertNotifier budgetAlertNotifier(AnalysisGatewayProperties properties) {
    AnalysisGatewayProperties.Alerts alerts = properties.getBudget().getAlerts();
    LoggingBudgetAlertNotifier logging = new LoggingBudgetAlertNotifier();
    if (!StringUtils.hasText(alerts.getWebhookUrl())) {
      return logging;
    }
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(alerts.getRequestTimeout());
    requestFactory.setReadTimeout(alerts.getRequestTimeout());
    RetryTemplate retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(alerts.getDeliveryAttempts())
            .fixedBackoff(alerts.getDeliveryBackoff().toMillis())
            .retryOn(RestClientException.class)
            .build();
    log.info("Budget alerts will be posted to the configured webhook");
    return new WebhookBudgetAlertNotifier(
        RestClient.builder().requestFactory(requestFactory).build(),
        alerts.getWebhookUrl(),
        alerts.getUsername(),
        retryTemplate,
        logging);
  }

  @Bean
  public BudgetMeter budgetMeter(
      AnalysisGatewayProperties properties,
      Clock analysisClock,
      BudgetAlertNotifier budgetAlertNotifier,
      @Qualifier("budgetAlertExecutor") ExecutorService budgetAlertExecutor,
      MeterRegistry meterRegistry) {
    AnalysisGatewayProperties.Budget budget = properties.getBudget();
    BudgetMeter meter =
        new BudgetMeter(
            budget.getHourlyTokens(),
            budget.getDailyTokens(),
            budget.getDailyCostUsd(),
            analysisClock,
            budgetAlertNotifier,
            budgetAlertExecutor);
    Gauge.builder("analysis.budget.used.percent", meter, value -> value.usage().pctUsed())
        .description("Highest share of any LLM budget window in use")
        .register(meterRegistry);
    return meter;
  }

  @Bean
  public AnalysisCacheStore analysisCacheStore(
      AnalysisGatewayProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplateProvider,
      ObjectMapper objectMapper,
      Clock analysisClock) {
    AnalysisGatewayProperties.Cache cache = properties.getCache();
    if (cache.getStore() == AnalysisGatewayProperties.CacheStoreType.REDIS) {
      StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
      if (redisTemplate != null) {
        return new RedisAnalysisCacheStore(redisTemplate, objectMapper, cache.getKeyPrefix());
      }
      log.warn("Redis analysis cache requested but no Redis connection is configured, using in-memory cache");
    }
    return new InMemoryAnalysisCacheStore(cache.getMaximumSize(), analysisClock);
  }

  @Bean
  public AnalysisResponseCache analysisResponseCache(
      AnalysisGatewayProperties properties, AnalysisCacheStore analysisCacheStore, MeterRegistry meterRegistry) {
    AnalysisResponseCache responseCache =
        new AnalysisResponseCache(analysisCacheStore, properties.getCache().getTtl());
    Gauge.builder("analysis.cache.inflight", responseCache, AnalysisResponseCache::inFlightCount)
        .description("Analyses currently being computed")
        .register(meterRegistry);
    return responseCache;
  }

  @Bean
  public AnalysisCacheKeyFactory analysisCacheKeyFactory(
      AnalysisGatewayProperties properties, ObjectMapper objectMapper) {
    return new AnalysisCacheKeyFactory(
        objectMapper, properties.getCache().getKeyPrefix(), properties.getPrompt().getCardVersion());
  }

  @Bean
  public ChatSummaryRenderer chatSummaryRenderer() {
    return new ChatSummaryRenderer();
  }

  @Bean
  public AnalysisPromptFactory analysisPromptFactory(AnalysisGatewayProperties properties) {
    return new AnalysisPromptFactory(
        properties.getPrompt().getCardVersion(),
        new EventContextCompactor(properties.getPrompt().getMaxExamples()),
        properties.getFallback().getWindow());
  }

  @Bean
  public AnalysisResponseParser analysisResponseParser(ObjectMapper objectMapper) {
    return new AnalysisResponseParser(objectMapper, ChatSummaryRenderer.MAX_LINES);
  }

  @Bean
  public FallbackSummarizer fallbackSummarizer(
      AnalysisGatewayProperties properties, ChatSummaryRenderer chatSummaryRenderer, Clock analysisClock) {
    return new FallbackSummarizer(properties.getFallback(), chatSummaryRenderer, analysisClock);
  }

  @Bean
  public ProviderChainResolver providerChainResolver(
      AnalysisGatewayProperties properties, ProviderRegistry analysisProviderRegistry) {
    return new ProviderChainResolver(analysisProviderRegistry, properties.getChain(), properties.getRouting());
  }

  @Bean
  public UsageCostEstimator usageCostEstimator(
      AnalysisGatewayProperties properties, TokenUsageEstimator tokenUsageEstimator) {
    return new UsageCostEstimator(properties.getProviders(), tokenUsageEstimator);
  }

  @Bean
  public AnalysisGateway analysisGateway(
      AnalysisGatewayProperties properties,
      AnalysisPolicyEngine analysisPolicyEngine,
      AnalysisCacheKeyFactory analysisCacheKeyFactory,
      AnalysisResponseCache analysisResponseCache,
      BudgetMeter budgetMeter,
      TokenBucketRateLimiter analysisRateLimiter,
      ProviderChainResolver providerChainResolver,
      CircuitBreakerRegistry circuitBreakerRegistry,
      AnalysisPromptFactory analysisPromptFactory,
      AnalysisResponseParser analysisResponseParser,
      ChatSummaryRenderer chatSummaryRenderer,
      UsageCostEstimator usageCostEstimator,
      FallbackSummarizer fallbackSummarizer,
      @Qualifier("analysisProviderExecutor") ExecutorService analysisProviderExecutor,
      AnalysisGatewayMetrics analysisGatewayMetrics,
      Clock analysisClock) {
    return new AnalysisGateway(
        analysisPolicyEngine,
        analysisCacheKeyFactory,
        analysisResponseCache,
        budgetMeter,
        analysisRateLimiter,
        providerChainResolver,
        circuitBreakerRegistry,
        analysisPromptFactory,
        analysisResponseParser,
        chatSummaryRenderer,
        usageCostEstimator,
        fallbackSummarizer,
        analysisProviderExecutor,
        providerId -> providerTimeout(properties, providerId),
        new GenerationParams(properties.getMaxTokensPerCall(), properties.getTemperature()),
        analysisGatewayMetrics,
        analysisClock);
  }

  @Bean
  public AnalysisStatusService analysisStatusService(
      BudgetMeter budgetMeter,
      TokenBucketRateLimiter analysisRateLimiter,
      CircuitBreakerRegistry circuitBreakerRegistry,
      AnalysisResponseCache analysisResponseCache,
      ProviderRegistry analysisProviderRegistry,
      ProviderChainResolver providerChainResolver) {
    return new AnalysisStatusService(
        budgetMeter,
        analysisRateLimiter,
        circuitBreakerRegistry,
        analysisResponseCache,
        analysisProviderRegistry,
        providerChainResolver);
  }

  @Bean
  public AnalysisProvidersHealthIndicator analysisProvidersHealthIndicator(
      ProviderRegistry analysisProviderRegistry, CircuitBreakerRegistry circuitBreakerRegistry) {
    return new AnalysisProvidersHealthIndicator(analysisProviderRegistry, circuitBreakerRegistry);
  }

  private static Duration providerTimeout(AnalysisGatewayProperties properties, String providerId) {
    AnalysisGatewayProperties.Provider provider = properties.getProviders().get(providerId);
    return provider != null && provider.getTimeout() != null ? provider.getTimeout() : DEFAULT_PROVIDER_TIMEOUT;
  }
}
