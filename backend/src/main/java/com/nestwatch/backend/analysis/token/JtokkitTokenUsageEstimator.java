package com.nestwatch.backend.analysis.token;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.ModelType;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

/**
 * Counts tokens with jtokkit encodings. Counts are memoized per tokenizer and text digest because
 * the same compacted event context is usually estimated several times within the cache TTL.
 */
public class JtokkitTokenUsageEstimator implements TokenUsageEstimator {

  private static final Logger log = LoggerFactory.getLogger(JtokkitTokenUsageEstimator.class);

  private final EncodingRegistry encodingRegistry;
  private final String defaultTokenizer;
  private final Cache<String, Integer> counts;

  public JtokkitTokenUsageEstimator(
      EncodingRegistry encodingRegistry, String defaultTokenizer, long maxCachedCounts) {
    this.encodingRegistry = encodingRegistry;
    this.defaultTokenizer = StringUtils.hasText(defaultTokenizer) ? defaultTokenizer : "cl100k_base";
    this.counts = Caffeine.newBuilder().maximumSize(Math.max(1, maxCachedCounts)).build();
  }

  @Override
  public Estimate estimate(EstimateRequest request) {
    if (request == null) {
      return Estimate.EMPTY;
    }
    String tokenizer = request.tokenizer() != null ? request.tokenizer() : defaultTokenizer;
    Encoding encoding = resolveEncoding(tokenizer);
    int promptTokens = count(encoding, tokenizer, request.prompt());
    int completionTokens = count(encoding, tokenizer, request.completion());
    if (log.isDebugEnabled()) {
      log.debug(
          "Estimated tokens for provider='{}' via tokenizer='{}': prompt={}, completion={}",
          request.providerId(),
          tokenizer,
          promptTokens,
          completionTokens);
    }
    return new Estimate(promptTokens, completionTokens);
  }

  private int count(Encoding encoding, String tokenizer, String text) {
    if (text == null) {
      return 0;
    }
    String key = tokenizer + ":" + DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    return counts.get(key, ignored -> countUncached(encoding, tokenizer, text));
  }

  private int countUncached(Encoding encoding, String tokenizer, String text) {
    if (encoding == null) {
      return approximate(text);
    }
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException ex) {
      log.warn("Tokenizer '{}' failed, using character based approximation", tokenizer, ex);
      return approximate(text);
    }
  }

  // roughly four characters per token for latin text
  public static int approximate(String text) {
    return (text.length() + 3) / 4;
  }

  private Encoding resolveEncoding(String tokenizer) {
    Optional<Encoding> encoding = encodingRegistry.getEncodingForModel(tokenizer);
    if (encoding.isPresent()) {
      return encoding.get();
    }
    Optional<ModelType> modelType = ModelType.fromName(tokenizer);
    if (modelType.isPresent()) {
      return encodingRegistry.getEncodingForModel(modelType.get());
    }
    Optional<EncodingType> encodingType = EncodingType.fromName(tokenizer);
    if (encodingType.isPresent()) {
      return encodingRegistry.getEncoding(encodingType.get());
    }
    Optional<Encoding> custom = encodingRegistry.getEncoding(tokenizer);
    if (custom.isEmpty()) {
      log.warn("Unknown tokenizer '{}', using character based approximation", tokenizer);
    }
    return custom.orElse(null);
  }
}
