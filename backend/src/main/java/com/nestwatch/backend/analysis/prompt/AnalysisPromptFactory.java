package com.nestwatch.backend.analysis.prompt;

import com.nestwatch.backend.analysis.api.AnalysisProfile;
import com.nestwatch.backend.analysis.api.RequestContext;
import com.nestwatch.backend.analysis.provider.model.AnalysisPrompt;

/** Builds the event analysis prompt: system role, task card, compacted context, request line. */
public class AnalysisPromptFactory {

  private static final String SYSTEM_PROMPT =
      """
      You are a senior site reliability engineer triaging monitoring events from Jira, Datadog and JAMS.
      Be factual and terse. Never invent event ids, counts or sources that are not in the context.
      Every proposed action is a dry run that a human must approve.
      """;

  private static final String EVENT_ANALYSIS_CARD =
      """
      Task card %s.
      Return one JSON object with exactly these keys:
        window (string), totals (integer),
        by_priority (object P1/P2/P3 -> integer), by_source (object source -> integer),
        clusters (array of {theme, count, representatives: [event id], suggested_owner}),
        top_events (array of at most 10 {id, priority, source, why_top}, P1 and P2 first),
        recommendations (array of at most 5 strings),
        actions (array of {provider, dry_run: true, why, risk, rollback}),
        next_data_to_fetch (array of strings).
      Group repetitive P3 noise into clusters instead of listing it in top_events.
      """;

  private static final String JSON_PROFILE = "Output profile: json. Respond with the JSON object only, no prose, no code fences.";

  private static final String CHAT_PROFILE =
      "Output profile: chat. Respond with the JSON object first, then at most 8 short plain-text lines for an on-call engineer.";

  private final String cardVersion;
  private final EventContextCompactor compactor;
  private final String window;

  public AnalysisPromptFactory(String cardVersion, EventContextCompactor compactor, String window) {
    this.cardVersion = cardVersion;
    this.compactor = compactor;
    this.window = window;
  }

  public String cardVersion() {
    return cardVersion;
  }

  public AnalysisPrompt build(RequestContext context) {
    String profileLine = context.profile() == AnalysisProfile.CHAT ? CHAT_PROFILE : JSON_PROFILE;
    String system = SYSTEM_PROMPT + "\n" + EVENT_ANALYSIS_CARD.formatted(cardVersion) + "\n" + profileLine;
    String user =
        "Context:\n"
            + compactor.compact(context.events())
            + "\n\nAnalyze events window="
            + window
            + ". Request type: "
            + context.requestType()
            + ".";
    return new AnalysisPrompt(system, user);
  }
}
