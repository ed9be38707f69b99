package com.nestwatch.backend.analysis.config;

import com.nestwatch.backend.analysis.provider.ProviderErrorKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.analysis")
@Validated
public class AnalysisGatewayProperties {

  /** Explicit provider priority chain. Providers are tried in this order. */
  @NotEmpty
  private List<String> chain =
      new ArrayList<>(List.of("bedrock", "anthropic", "nemo_local", "openai"));

  /** Request type to preferred provider. The preferred provider is tried before the chain. */
  private Map<String, String> routing = new LinkedHashMap<>();

  @Positive private int maxTokensPerCall = 600;

  @DecimalMin("0.0")
  private double temperature = 0.0;

  /** Upper bound for concurrently running provider calls. */
  @Positive private int providerCallConcurrency = 8;

  @Valid private Cache cache = new Cache();
  @Valid private CircuitBreaker circuitBreaker = new CircuitBreaker();
  @Valid private RateLimit rateLimit = new RateLimit();
  @Valid private Budget budget = new Budget();
  @Valid private Policy policy = new Policy();
  @Valid private Fallback fallback = new Fallback();
  @Valid private Prompt prompt = new Prompt();
  private Map<String, Provider> providers = new LinkedHashMap<>();

  public List<String> getChain() {
    return chain;
  }

  public void setChain(List<String> chain) {
    this.chain = chain;
  }

  public Map<String, String> getRouting() {
    return routing;
  }

  public void setRouting(Map<String, String> routing) {
    this.routing = routing;
  }

  public int getMaxTokensPerCall() {
    return maxTokensPerCall;
  }

  public void setMaxTokensPerCall(int maxTokensPerCall) {
    this.maxTokensPerCall = maxTokensPerCall;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public int getProviderCallConcurrency() {
    return providerCallConcurrency;
  }

  public void setProviderCallConcurrency(int providerCallConcurrency) {
    this.providerCallConcurrency = providerCallConcurrency;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
    this.circuitBreaker = circuitBreaker;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public void setRateLimit(RateLimit rateLimit) {
    this.rateLimit = rateLimit;
  }

  public Budget getBudget() {
    return budget;
  }

  public void setBudget(Budget budget) {
    this.budget = budget;
  }

  public Policy getPolicy() {
    return policy;
  }

  public void setPolicy(Policy policy) {
    this.policy = policy;
  }

  public Fallback getFallback() {
    return fallback;
  }

  public void setFallback(Fallback fallback) {
    this.fallback = fallback;
  }

  public Prompt getPrompt() {
    return prompt;
  }

  public void setPrompt(Prompt prompt) {
    this.prompt = prompt;
  }

  public Map<String, Provider> getProviders() {
    return providers;
  }

  public void setProviders(Map<String, Provider> providers) {
    this.providers = providers;
  }

  public enum CacheStoreType {
    MEMORY,
    REDIS
  }

  public static class Cache {

    /** Lifetime of a cached live analysis. */
    @NotNull private Duration ttl = Duration.ofSeconds(300);

    private CacheStoreType store = CacheStoreType.MEMORY;

    /** Secondary bound for the in-memory store; TTL is the primary eviction policy. */
    @Positive private long maximumSize = 1_000;

    private String keyPrefix = "llm:analysis";

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public CacheStoreType getStore() {
      return store;
    }

    public void setStore(CacheStoreType store) {
      this.store = store;
    }

    public long getMaximumSize() {
      return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
      this.maximumSize = maximumSize;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }
  }

  public static class CircuitBreaker {

    @Positive private int failureThreshold = 5;

    /** Failures further apart than this restart the consecutive failure streak. */
    @NotNull private Duration failureWindow = Duration.ofMinutes(10);

    @NotNull private Duration cooldown = Duration.ofMinutes(30);

    /** Failure kinds that open the breaker on first occurrence. */
    private Set<ProviderErrorKind> tripImmediatelyOn = EnumSet.of(ProviderErrorKind.QUOTA_EXHAUSTED);

    public int getFailureThreshold() {
      return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
    }

    public Duration getFailureWindow() {
      return failureWindow;
    }

    public void setFailureWindow(Duration failureWindow) {
      this.failureWindow = failureWindow;
    }

    public Duration getCooldown() {
      return cooldown;
    }

    public void setCooldown(Duration cooldown) {
      this.cooldown = cooldown;
    }

    public Set<ProviderErrorKind> getTripImmediatelyOn() {
      return tripImmediatelyOn;
    }

    public void setTripImmediatelyOn(Set<ProviderErrorKind> tripImmediatelyOn) {
      this.tripImmediatelyOn = tripImmediatelyOn;
    }
  }

  public static class RateLimit {

    @DecimalMin(value = "0.0", inclusive = false)
    private double requestsPerSecond = 0.5;

    @Positive private int burst = 2;

    public double getRequestsPerSecond() {
      return requestsPerSecond;
    }

    public void setRequestsPerSecond(double requestsPerSecond) {
      this.requestsPerSecond = requestsPerSecond;
    }

    public int getBurst() {
      return burst;
    }

    public void setBurst(int burst) {
      this.burst = burst;
    }
  }

  public static class Budget {

    @Positive private long hourlyTokens = 40_000;
    @Positive private long dailyTokens = 200_000;

    /** Daily spend ceiling in USD. Zero disables cost enforcement. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal dailyCostUsd = BigDecimal.ZERO;

    @Valid private Alerts alerts = new Alerts();

    public long getHourlyTokens() {
      return hourlyTokens;
    }

    public void setHourlyTokens(long hourlyTokens) {
      this.hourlyTokens = hourlyTokens;
    }

    public long getDailyTokens() {
      return dailyTokens;
    }

    public void setDailyTokens(long dailyTokens) {
      this.dailyTokens = dailyTokens;
    }

    public BigDecimal getDailyCostUsd() {
      return dailyCostUsd;
    }

    public void setDailyCostUsd(BigDecimal dailyCostUsd) {
      this.dailyCostUsd = dailyCostUsd;
    }

    public Alerts getAlerts() {
      return alerts;
    }

    public void setAlerts(Alerts alerts) {
      this.alerts = alerts;
    }
  }

  public static class Alerts {

    /** Slack-compatible incoming webhook. Alerts are only logged when unset. */
    private String webhookUrl;

    private String username = "SRE Dashboard";

    @Min(1)
    private int deliveryAttempts = 3;

    @NotNull private Duration deliveryBackoff = Duration.ofSeconds(1);

    @NotNull private Duration requestTimeout = Duration.ofSeconds(10);

    public String getWebhookUrl() {
      return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
      this.webhookUrl = webhookUrl;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public int getDeliveryAttempts() {
      return deliveryAttempts;
    }

    public void setDeliveryAttempts(int deliveryAttempts) {
      this.deliveryAttempts = deliveryAttempts;
    }

    public Duration getDeliveryBackoff() {
      return deliveryBackoff;
    }

    public void setDeliveryBackoff(Duration deliveryBackoff) {
      this.deliveryBackoff = deliveryBackoff;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }
  }

  public static class Policy {

    private boolean enabled = true;

    /** Live analysis is skipped when there are no P1 events and at most this many P2 events. */
    @Min(0)
    private int maxP2ForSkip = 2;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getMaxP2ForSkip() {
      return maxP2ForSkip;
    }

    public void setMaxP2ForSkip(int maxP2ForSkip) {
      this.maxP2ForSkip = maxP2ForSkip;
    }
  }

  public static class Fallback {

    private Map<String, Double> sourceWeights =
        new LinkedHashMap<>(Map.of("jira", 1.0, "datadog", 0.9, "jams", 0.7));

    @DecimalMin("0.0")
    private double defaultSourceWeight = 0.5;

    @DecimalMin("0.0")
    private double keywordBoost = 0.5;

    private List<String> impactKeywords =
        new ArrayList<>(
            List.of("payment", "checkout", "auth", "login", "api-gw", "db", "kafka", "timeout", "5xx"));

    private String window = "last_24h";

    public Map<String, Double> getSourceWeights() {
      return sourceWeights;
    }

    public void setSourceWeights(Map<String, Double> sourceWeights) {
      this.sourceWeights = sourceWeights;
    }

    public double getDefaultSourceWeight() {
      return defaultSourceWeight;
    }

    public void setDefaultSourceWeight(double defaultSourceWeight) {
      this.defaultSourceWeight = defaultSourceWeight;
    }

    public double getKeywordBoost() {
      return keywordBoost;
    }

    public void setKeywordBoost(double keywordBoost) {
      this.keywordBoost = keywordBoost;
    }

    public List<String> getImpactKeywords() {
      return impactKeywords;
    }

    public void setImpactKeywords(List<String> impactKeywords) {
      this.impactKeywords = impactKeywords;
    }

    public String getWindow() {
      return window;
    }

    public void setWindow(String window) {
      this.window = window;
    }
  }

  public static class Prompt {

    /** Version of the event analysis card; part of every cache key. */
    private String cardVersion = "event_analysis_v1";

    /** Events included verbatim in the compacted prompt context. */
    @Positive private int maxExamples = 12;

    public String getCardVersion() {
      return cardVersion;
    }

    public void setCardVersion(String cardVersion) {
      this.cardVersion = cardVersion;
    }

    public int getMaxExamples() {
      return maxExamples;
    }

    public void setMaxExamples(int maxExamples) {
      this.maxExamples = maxExamples;
    }
  }

  public static class Provider {

    private AnalysisProviderType type;
    private boolean enabled = true;
    private String displayName;
    private String model;
    private String baseUrl;
    private String apiKey;
    private String region;
    private Duration timeout = Duration.ofSeconds(30);
    private Integer maxTokens;
    private Double temperature;

    /** jtokkit tokenizer used when the vendor response carries no usage metadata. */
    private String tokenizer;

    private Pricing pricing = new Pricing();

    public AnalysisProviderType getType() {
      return type;
    }

    public void setType(AnalysisProviderType type) {
      this.type = type;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getRegion() {
      return region;
    }

    public void setRegion(String region) {
      this.region = region;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Integer getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }

    public String getTokenizer() {
      return tokenizer;
    }

    public void setTokenizer(String tokenizer) {
      this.tokenizer = tokenizer;
    }

    public Pricing getPricing() {
      return pricing;
    }

    public void setPricing(Pricing pricing) {
      this.pricing = pricing;
    }
  }

  public static class Pricing {
    private BigDecimal inputPer1KTokens = BigDecimal.ZERO;
    private BigDecimal outputPer1KTokens = BigDecimal.ZERO;

    public BigDecimal getInputPer1KTokens() {
      return inputPer1KTokens;
    }

    public void setInputPer1KTokens(BigDecimal inputPer1KTokens) {
      this.inputPer1KTokens = inputPer1KTokens;
    }

    public BigDecimal getOutputPer1KTokens() {
      return outputPer1KTokens;
    }

    public void setOutputPer1KTokens(BigDecimal outputPer1KTokens) {
      this.outputPer1KTokens = outputPer1KTokens;
    }
  }
}
