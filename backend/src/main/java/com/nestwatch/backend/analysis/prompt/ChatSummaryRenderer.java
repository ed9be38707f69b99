package com.nestwatch.backend.analysis.prompt;

import com.nestwatch.backend.analysis.api.AnalysisPayload;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/** Deterministic human summary of an analysis payload, never longer than {@link #MAX_LINES} lines. */
public class ChatSummaryRenderer {

  public static final int MAX_LINES = 8;
  private static final int MAX_TOP_EVENTS = 3;

  public String render(AnalysisPayload payload) {
    List<String> lines = new ArrayList<>(MAX_LINES);
    lines.add(
        String.format(
            "%d events in %s: P1=%d, P2=%d, P3=%d",
            payload.totals(),
            payload.window(),
            payload.byPriority().getOrDefault("P1", 0),
            payload.byPriority().getOrDefault("P2", 0),
            payload.byPriority().getOrDefault("P3", 0)));
    if (!payload.bySource().isEmpty()) {
      StringJoiner sources = new StringJoiner(", ", "Sources: ", "");
      payload.bySource().forEach((source, count) -> sources.add(source + "=" + count));
      lines.add(sources.toString());
    }
    payload.topEvents().stream()
        .limit(MAX_TOP_EVENTS)
        .forEach(
            event ->
                lines.add(
                    String.format(
                        "Top: %s [%s/%s] %s", event.id(), event.priority(), event.source(), event.whyTop())));
    if (!payload.clusters().isEmpty()) {
      AnalysisPayload.Cluster largest = payload.clusters().get(0);
      lines.add(
          String.format(
              "Noise: %d cluster(s), largest '%s' with %d events",
              payload.clusters().size(),
              largest.theme(),
              largest.count()));
    }
    if (!payload.recommendations().isEmpty()) {
      lines.add("Next: " + payload.recommendations().get(0));
    }
    return String.join("\n", lines.subList(0, Math.min(lines.size(), MAX_LINES)));
  }
}
