package com.nestwatch.backend.analysis.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured event analysis. Live providers, the cache and the fallback summarizer all produce
 * this exact shape so callers can only tell them apart by {@link AnalysisResult#source()}.
 */
@Schema(description = "Structured SRE event analysis")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AnalysisPayload(
    String window,
    int totals,
    @JsonProperty("by_priority") Map<String, Integer> byPriority,
    @JsonProperty("by_source") Map<String, Integer> bySource,
    List<Cluster> clusters,
    @JsonProperty("top_events") List<TopEvent> topEvents,
    List<String> recommendations,
    List<Action> actions,
    @JsonProperty("next_data_to_fetch") List<String> nextDataToFetch) {

  public static final int MAX_TOP_EVENTS = 10;

  public AnalysisPayload {
    byPriority = orderedCopy(byPriority);
    bySource = orderedCopy(bySource);
    clusters = nullSafe(clusters);
    topEvents = nullSafe(topEvents);
    recommendations = nullSafe(recommendations);
    actions = nullSafe(actions);
    nextDataToFetch = nullSafe(nextDataToFetch);
  }

  private static <T> List<T> nullSafe(List<T> values) {
    return values == null ? List.of() : values.stream().toList();
  }

  private static Map<String, Integer> orderedCopy(Map<String, Integer> values) {
    if (values == null) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public record Cluster(
      String theme,
      int count,
      List<String> representatives,
      @JsonProperty("suggested_owner") String suggestedOwner) {

    public Cluster {
      representatives = representatives == null ? List.of() : representatives.stream().toList();
    }
  }

  public record TopEvent(
      String id,
      EventPriority priority,
      String source,
      @JsonProperty("why_top") String whyTop) {}

  public record Action(
      String provider,
      @JsonProperty("dry_run") boolean dryRun,
      String why,
      String risk,
      String rollback) {}
}
