package com.nestwatch.backend.analysis.fallback;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Keyword derived grouping for low-priority noise. */
enum EventTheme {
  PAYMENTS("payments", "payments-team", "payment", "checkout", "billing"),
  AUTHENTICATION("authentication", "identity-team", "auth", "login", "sso", "token"),
  API_GATEWAY("api-gateway", "platform-team", "api-gw", "gateway"),
  DATABASE("database", "dba-team", "db", "database", "sql", "postgres"),
  MESSAGING("messaging", "streaming-team", "kafka", "queue", "consumer lag"),
  LATENCY("latency", "sre-oncall", "timeout", "5xx", "latency", "slow");

  private final String label;
  private final String owner;
  private final List<Pattern> patterns;

  EventTheme(String label, String owner, String... keywords) {
    this.label = label;
    this.owner = owner;
    this.patterns = List.of(keywords).stream().map(EventTheme::keywordPattern).toList();
  }

  String label() {
    return label;
  }

  String owner() {
    return owner;
  }

  static Optional<EventTheme> detect(String summary) {
    if (summary == null || summary.isBlank()) {
      return Optional.empty();
    }
    String text = summary.toLowerCase(Locale.ROOT);
    for (EventTheme theme : values()) {
      for (Pattern pattern : theme.patterns) {
        if (pattern.matcher(text).find()) {
          return Optional.of(theme);
        }
      }
    }
    return Optional.empty();
  }

  /** Matches the keyword at the start of a word, so "payment" also matches "payments". */
  static Pattern keywordPattern(String keyword) {
    return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)));
  }

  static String noiseOwner(String source) {
    return switch (source) {
      case "jira" -> "triage-rotation";
      case "datadog" -> "observability-team";
      case "jams" -> "batch-operations";
      default -> "sre-oncall";
    };
  }
}
