package com.nestwatch.backend.analysis.fallback;

import com.nestwatch.backend.analysis.api.AnalysisPayload;
import com.nestwatch.backend.analysis.api.AnalysisProfile;
import com.nestwatch.backend.analysis.api.AnalysisResult;
import com.nestwatch.backend.analysis.api.EventPriority;
import com.nestwatch.backend.analysis.api.EventSnippet;
import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.prompt.ChatSummaryRenderer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Rule-based analysis that needs no language model. Produces the same payload shape as a live
 * provider so callers can degrade without special handling.
 */
public class FallbackSummarizer {

  private static final Logger log = LoggerFactory.getLogger(FallbackSummarizer.class);

  static final int MAX_RECOMMENDATIONS = 5;
  static final int MAX_REPRESENTATIVES = 3;
  static final int MAX_NEXT_DATA = 5;
  static final int BATCH_TRIAGE_MIN_CLUSTER = 5;
  private static final int MAX_BATCH_ACTIONS = 3;

  private static final Set<String> ACTIVE_STATUSES = Set.of("open", "new", "investigating", "triggered");
  private static final Set<String> IN_PROGRESS_STATUSES =
      Set.of("in progress", "in_progress", "acknowledged", "mitigating");
  private static final Set<String> DONE_STATUSES = Set.of("resolved", "closed", "done", "recovered");

  private final Map<String, Double> sourceWeights;
  private final double defaultSourceWeight;
  private final double keywordBoost;
  private final List<ImpactKeyword> impactKeywords;
  private final String window;
  private final ChatSummaryRenderer summaryRenderer;
  private final Clock clock;

  public FallbackSummarizer(
      AnalysisGatewayProperties.Fallback settings, ChatSummaryRenderer summaryRenderer, Clock clock) {
    Map<String, Double> weights = new LinkedHashMap<>();
    settings.getSourceWeights().forEach((source, weight) -> weights.put(normalize(source), weight));
    this.sourceWeights = weights;
    this.defaultSourceWeight = settings.getDefaultSourceWeight();
    this.keywordBoost = settings.getKeywordBoost();
    this.impactKeywords =
        settings.getImpactKeywords().stream()
            .filter(StringUtils::hasText)
            .map(keyword -> new ImpactKeyword(keyword, EventTheme.keywordPattern(keyword)))
            .toList();
    this.window = settings.getWindow();
    this.summaryRenderer = summaryRenderer;
    this.clock = clock;
  }

  public AnalysisResult summarize(List<EventSnippet> events, AnalysisProfile profile) {
    List<RankedEvent> ranked = rank(validate(events));

    Map<String, Integer> byPriority = new LinkedHashMap<>();
    for (EventPriority priority : EventPriority.values()) {
      byPriority.put(priority.name(), 0);
    }
    Map<String, Integer> sourceCounts = new LinkedHashMap<>();
    for (RankedEvent event : ranked) {
      byPriority.merge(event.snippet().priority().name(), 1, Integer::sum);
      sourceCounts.merge(event.source(), 1, Integer::sum);
    }
    Map<String, Integer> bySource = new LinkedHashMap<>();
    sourceCounts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
        .forEach(entry -> bySource.put(entry.getKey(), entry.getValue()));

    List<AnalysisPayload.TopEvent> topEvents =
        ranked.stream()
            .filter(event -> event.snippet().priority() != EventPriority.P3)
            .limit(AnalysisPayload.MAX_TOP_EVENTS)
            .map(this::toTopEvent)
            .toList();
    List<AnalysisPayload.Cluster> clusters = cluster(ranked);

    AnalysisPayload payload =
        new AnalysisPayload(
            window,
            ranked.size(),
            byPriority,
            bySource,
            clusters,
            topEvents,
            recommendations(ranked, byPriority, sourceCounts, clusters, topEvents),
            actions(ranked, byPriority, clusters),
            nextDataToFetch(byPriority, sourceCounts));

    String chatSummary = profile == AnalysisProfile.CHAT ? summaryRenderer.render(payload) : null;
    log.debug(
        "Fallback summary built for {} events: {} top, {} clusters", ranked.size(), topEvents.size(), clusters.size());
    return AnalysisResult.fallback(payload, chatSummary, clock.instant());
  }

  private List<EventSnippet> validate(List<EventSnippet> events) {
    if (events == null) {
      throw new FallbackSummarizationException("events must not be null");
    }
    for (int i = 0; i < events.size(); i++) {
      EventSnippet event = events.get(i);
      if (event == null) {
        throw new FallbackSummarizationException("events[" + i + "] is null");
      }
      if (!StringUtils.hasText(event.id())) {
        throw new FallbackSummarizationException("events[" + i + "] has no id");
      }
      if (event.priority() == null) {
        throw new FallbackSummarizationException("event '" + event.id() + "' has no priority");
      }
    }
    return events;
  }

  List<RankedEvent> rank(List<EventSnippet> events) {
    return events.stream()
        .map(this::toRanked)
        .sorted(
            Comparator.comparingInt((RankedEvent event) -> event.snippet().priority().rank())
                .thenComparingInt(RankedEvent::statusRank)
                .thenComparing(Comparator.comparingDouble(RankedEvent::weight).reversed())
                .thenComparing(
                    event -> event.snippet().timestamp(),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                .thenComparing(event -> event.snippet().id()))
        .toList();
  }

  private RankedEvent toRanked(EventSnippet snippet) {
    String source = normalize(snippet.source());
    String summary = snippet.shortSummary() != null ? snippet.shortSummary().toLowerCase(Locale.ROOT) : "";
    List<String> matched =
        impactKeywords.stream()
            .filter(keyword -> keyword.pattern().matcher(summary).find())
            .map(ImpactKeyword::keyword)
            .toList();
    double weight = sourceWeights.getOrDefault(source, defaultSourceWeight) + keywordBoost * matched.size();
    return new RankedEvent(snippet, source, statusRank(snippet.status()), weight, matched);
  }

  static int statusRank(String status) {
    String value = normalize(status);
    if (ACTIVE_STATUSES.contains(value)) {
      return 0;
    }
    if (IN_PROGRESS_STATUSES.contains(value)) {
      return 1;
    }
    if (DONE_STATUSES.contains(value)) {
      return 3;
    }
    return 2;
  }

  private AnalysisPayload.TopEvent toTopEvent(RankedEvent event) {
    EventSnippet snippet = event.snippet();
    List<String> reasons = new ArrayList<>();
    reasons.add(snippet.priority() == EventPriority.P1 ? "Critical priority (P1)" : "High priority (P2)");
    if (event.statusRank() <= 1) {
      reasons.add("status " + snippet.status());
    }
    if (!event.keywords().isEmpty()) {
      reasons.add("impacts " + String.join(", ", event.keywords().subList(0, Math.min(3, event.keywords().size()))));
    }
    return new AnalysisPayload.TopEvent(snippet.id(), snippet.priority(), event.source(), String.join("; ", reasons));
  }

  private List<AnalysisPayload.Cluster> cluster(List<RankedEvent> ranked) {
    Map<String, List<RankedEvent>> groups = new LinkedHashMap<>();
    Map<String, String> owners = new LinkedHashMap<>();
    for (RankedEvent event : ranked) {
      if (event.snippet().priority() != EventPriority.P3) {
        continue;
      }
      EventTheme theme = EventTheme.detect(event.snippet().shortSummary()).orElse(null);
      String label = theme != null ? theme.label() : event.source() + "-noise";
      groups.computeIfAbsent(label, key -> new ArrayList<>()).add(event);
      owners.putIfAbsent(label, theme != null ? theme.owner() : EventTheme.noiseOwner(event.source()));
    }
    return groups.entrySet().stream()
        .sorted(
            Comparator.comparingInt((Map.Entry<String, List<RankedEvent>> entry) -> entry.getValue().size())
                .reversed()
                .thenComparing(Map.Entry::getKey))
        .map(
            entry ->
                new AnalysisPayload.Cluster(
                    entry.getKey(),
                    entry.getValue().size(),
                    entry.getValue().stream()
                        .limit(MAX_REPRESENTATIVES)
                        .map(event -> event.snippet().id())
                        .toList(),
                    owners.get(entry.getKey())))
        .toList();
  }

  private List<String> recommendations(
      List<RankedEvent> ranked,
      Map<String, Integer> byPriority,
      Map<String, Integer> sourceCounts,
      List<AnalysisPayload.Cluster> clusters,
      List<AnalysisPayload.TopEvent> topEvents) {
    List<String> result = new ArrayList<>();
    int p1 = byPriority.get("P1");
    int p2 = byPriority.get("P2");
    if (p1 > 0) {
      result.add(
          "CRITICAL: address " + p1 + " P1 event(s) immediately, starting with " + topEvents.get(0).id());
    }
    if (p2 > 3) {
      result.add("HIGH: " + p2 + " P2 events detected, consider raising monitoring sensitivity");
    }
    int datadog = sourceCounts.getOrDefault("datadog", 0);
    if (datadog > 20) {
      result.add("Datadog: high alert volume (" + datadog + "), review alert thresholds and reduce noise");
    }
    int jams = sourceCounts.getOrDefault("jams", 0);
    if (jams > 5) {
      result.add("JAMS: " + jams + " job events, investigate job dependencies and retry logic");
    }
    int jira = sourceCounts.getOrDefault("jira", 0);
    if (jira > 3) {
      result.add("Jira: " + jira + " tickets, ensure proper triage and assignment");
    }
    long open = ranked.stream().filter(event -> event.statusRank() <= 1).count();
    if (open > 10) {
      result.add("Status: " + open + " events still open, consider automated resolution workflows");
    }
    long highImpact = ranked.stream().filter(event -> !event.keywords().isEmpty()).count();
    if (highImpact > 5) {
      result.add(
          "Impact: " + highImpact + " events touch high-impact components, review single points of failure");
    }
    clusters.stream()
        .filter(cluster -> cluster.count() >= BATCH_TRIAGE_MIN_CLUSTER)
        .forEach(
            cluster ->
                result.add(
                    "Batch-triage " + cluster.count() + " '" + cluster.theme() + "' P3 events with " + cluster.suggestedOwner()));
    if (result.isEmpty()) {
      result.add("System appears stable, continue monitoring for emerging issues");
    }
    return result.size() > MAX_RECOMMENDATIONS ? result.subList(0, MAX_RECOMMENDATIONS) : result;
  }

  private List<AnalysisPayload.Action> actions(
      List<RankedEvent> ranked, Map<String, Integer> byPriority, List<AnalysisPayload.Cluster> clusters) {
    List<AnalysisPayload.Action> result = new ArrayList<>();
    int urgent = byPriority.get("P1") + byPriority.get("P2");
    if (urgent > 0) {
      result.add(
          new AnalysisPayload.Action(
              "slack",
              true,
              "Notify on-call about " + urgent + " high-priority event(s) requiring attention",
              "Low - informational notification only",
              "No rollback needed for notifications"));
    }
    if (ranked.size() > 20) {
      result.add(
          new AnalysisPayload.Action(
              "datadog",
              true,
              "Review and tune alert thresholds to reduce noise",
              "Low - read-only analysis",
              "No changes made, analysis only"));
    }
    clusters.stream()
        .filter(cluster -> cluster.count() >= BATCH_TRIAGE_MIN_CLUSTER)
        .limit(MAX_BATCH_ACTIONS)
        .forEach(
            cluster ->
                result.add(
                    new AnalysisPayload.Action(
                        "jira",
                        true,
                        "Track " + cluster.count() + " '" + cluster.theme() + "' P3 events in one triage ticket for " + cluster.suggestedOwner(),
                        "Low - creates a single tracking ticket",
                        "Close the tracking ticket")));
    return result;
  }

  private List<String> nextDataToFetch(Map<String, Integer> byPriority, Map<String, Integer> sourceCounts) {
    List<String> result = new ArrayList<>();
    if (byPriority.get("P1") > 0) {
      result.add("recent deploys and change events for services named in P1 events");
    }
    if (byPriority.get("P1") + byPriority.get("P2") > 0) {
      result.add("error rate and latency metrics for affected services over the last hour");
    }
    if (sourceCounts.containsKey("datadog")) {
      result.add("datadog monitor history for the noisiest monitors");
    }
    if (sourceCounts.containsKey("jams")) {
      result.add("JAMS run logs for failed jobs");
    }
    if (sourceCounts.containsKey("jira")) {
      result.add("assignees and linked issues for open Jira tickets");
    }
    if (result.isEmpty()) {
      result.add("events from the next " + window + " window");
    }
    return result.size() > MAX_NEXT_DATA ? result.subList(0, MAX_NEXT_DATA) : result;
  }

  private static String normalize(String value) {
    return StringUtils.hasText(value) ? value.trim().toLowerCase(Locale.ROOT) : "unknown";
  }

  record RankedEvent(EventSnippet snippet, String source, int statusRank, double weight, List<String> keywords) {}

  private record ImpactKeyword(String keyword, Pattern pattern) {}
}
