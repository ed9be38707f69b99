package com.nestwatch.backend.analysis.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nestwatch.backend.analysis.api.EventSnippet;
import com.nestwatch.backend.analysis.api.RequestContext;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Content-addressed cache keys. Equivalent requests collide: events are reduced to the fields that
 * influence the analysis, with summaries cut to {@value #SUMMARY_LIMIT} characters, then sorted on
 * all of those fields. The profile and the prompt card version are part of the key; the request
 * type is not.
 */
public class AnalysisCacheKeyFactory {

  static final int SUMMARY_LIMIT = 100;
  private static final int HASH_HEX_LENGTH = 32;

  private final ObjectMapper objectMapper;
  private final String keyPrefix;
  private final String cardVersion;

  public AnalysisCacheKeyFactory(ObjectMapper objectMapper, String keyPrefix, String cardVersion) {
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
    this.cardVersion = cardVersion;
  }

  public String keyFor(RequestContext context) {
    List<CanonicalEvent> canonical =
        context.events().stream()
            .filter(Objects::nonNull)
            .map(CanonicalEvent::of)
            .sorted(CanonicalEvent.ORDER)
            .toList();
    Map<String, Object> material = new LinkedHashMap<>();
    material.put("card", cardVersion);
    material.put("profile", context.profile().value());
    material.put("events", canonical);
    String json;
    try {
      json = objectMapper.writeValueAsString(material);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to canonicalize analysis request", ex);
    }
    return keyPrefix + ":" + cardVersion + ":" + sha256(json).substring(0, HASH_HEX_LENGTH);
  }

  /** The fields of an event that influence the analysis, in key order. */
  record CanonicalEvent(String id, String source, String priority, String status, String summary) {

    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    // every field takes part so events sharing an id still sort deterministically
    static final Comparator<CanonicalEvent> ORDER =
        Comparator.comparing(CanonicalEvent::id, NULLS_LAST)
            .thenComparing(CanonicalEvent::source, NULLS_LAST)
            .thenComparing(CanonicalEvent::priority, NULLS_LAST)
            .thenComparing(CanonicalEvent::status, NULLS_LAST)
            .thenComparing(CanonicalEvent::summary, NULLS_LAST);

    static CanonicalEvent of(EventSnippet event) {
      String summary = event.shortSummary();
      return new CanonicalEvent(
          event.id(),
          event.source(),
          event.priority() != null ? event.priority().name() : null,
          event.status(),
          summary != null && summary.length() > SUMMARY_LIMIT ? summary.substring(0, SUMMARY_LIMIT) : summary);
    }
  }

  private static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }
}
