package com.nestwatch.backend.analysis.prompt;

import com.nestwatch.backend.analysis.api.EventPriority;
import com.nestwatch.backend.analysis.api.EventSnippet;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;
import org.springframework.util.StringUtils;

/**
 * Renders an event list as a short, token-efficient prompt context:
 *
 * <pre>
 * Totals=42; P1=1; P2=3; P3=38
 * Sources: datadog=30, jira=12
 * Examples:
 * - id=INC-1 src=jira pri=P1 status=Open sum=Checkout 5xx spike
 * </pre>
 */
public class EventContextCompactor {

  static final int EXAMPLE_SUMMARY_LIMIT = 60;

  private static final Comparator<EventSnippet> EXAMPLE_ORDER =
      Comparator.comparing(
              (EventSnippet event) -> event.priority() != null ? event.priority().rank() : Integer.MAX_VALUE)
          .thenComparing(EventSnippet::timestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(EventSnippet::id, Comparator.nullsLast(Comparator.<String>naturalOrder()));

  private final int maxExamples;

  public EventContextCompactor(int maxExamples) {
    if (maxExamples <= 0) {
      throw new IllegalArgumentException("maxExamples must be positive");
    }
    this.maxExamples = maxExamples;
  }

  public String compact(List<EventSnippet> events) {
    List<EventSnippet> present = events.stream().filter(Objects::nonNull).toList();
    Map<EventPriority, Integer> byPriority = new LinkedHashMap<>();
    for (EventPriority priority : EventPriority.values()) {
      byPriority.put(priority, 0);
    }
    Map<String, Integer> bySource = new TreeMap<>();
    for (EventSnippet event : present) {
      if (event.priority() != null) {
        byPriority.merge(event.priority(), 1, Integer::sum);
      }
      bySource.merge(sourceOf(event), 1, Integer::sum);
    }

    StringBuilder out = new StringBuilder();
    out.append("Totals=").append(present.size());
    byPriority.forEach((priority, count) -> out.append("; ").append(priority).append('=').append(count));
    out.append('\n');

    StringJoiner sources = new StringJoiner(", ");
    bySource.forEach((source, count) -> sources.add(source + "=" + count));
    out.append("Sources: ").append(bySource.isEmpty() ? "none" : sources.toString()).append('\n');

    out.append("Examples:");
    present.stream()
        .sorted(EXAMPLE_ORDER)
        .limit(maxExamples)
        .forEach(
            event ->
                out.append('\n')
                    .append("- id=").append(event.id())
                    .append(" src=").append(sourceOf(event))
                    .append(" pri=").append(event.priority())
                    .append(" status=").append(StringUtils.hasText(event.status()) ? event.status() : "unknown")
                    .append(" sum=").append(truncate(oneLine(event.shortSummary()), EXAMPLE_SUMMARY_LIMIT)));
    return out.toString();
  }

  static String sourceOf(EventSnippet event) {
    return StringUtils.hasText(event.source()) ? event.source().trim().toLowerCase(Locale.ROOT) : "unknown";
  }

  static String oneLine(String value) {
    if (value == null) {
      return "";
    }
    return value.replaceAll("\\s+", " ").trim();
  }

  static String truncate(String value, int limit) {
    if (value == null) {
      return "";
    }
    return value.length() <= limit ? value : value.substring(0, limit);
  }
}
