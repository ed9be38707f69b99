package com.nestwatch.backend.analysis.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nestwatch.backend.analysis.api.AnalysisResult;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.util.StringUtils;

/** Shared cache across gateway instances. Redis expiry enforces the TTL. */
public class RedisAnalysisCacheStore implements AnalysisCacheStore {

  private static final Logger log = LoggerFactory.getLogger(RedisAnalysisCacheStore.class);

  private final StringRedisTemplate redisTemplate;
  private final ValueOperations<String, String> valueOperations;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public RedisAnalysisCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.valueOperations = redisTemplate.opsForValue();
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public Optional<AnalysisResult> get(String key) {
    try {
      String value = valueOperations.get(key);
      if (!StringUtils.hasText(value)) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.readValue(value, AnalysisResult.class));
    } catch (JsonProcessingException ex) {
      log.warn("Dropping unreadable cached analysis for key {}", key, ex);
      invalidate(key);
      return Optional.empty();
    } catch (RuntimeException ex) {
      log.warn("Failed to read analysis from Redis cache, treating as miss", ex);
      return Optional.empty();
    }
  }

  @Override
  public void put(String key, AnalysisResult value, Duration ttl) {
    try {
      valueOperations.set(key, objectMapper.writeValueAsString(value), ttl);
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize analysis for key {}", key, ex);
    } catch (RuntimeException ex) {
      log.warn("Failed to store analysis in Redis cache", ex);
    }
  }

  @Override
  public void invalidate(String key) {
    try {
      redisTemplate.delete(key);
    } catch (RuntimeException ex) {
      log.warn("Failed to invalidate Redis cache key {}", key, ex);
    }
  }

  @Override
  public void clear() {
    try {
      Set<String> keys = redisTemplate.keys(keyPrefix + ":*");
      if (keys != null && !keys.isEmpty()) {
        redisTemplate.delete(keys);
      }
    } catch (RuntimeException ex) {
      log.warn("Failed to clear Redis analysis cache", ex);
    }
  }
}
