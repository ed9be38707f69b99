package com.nestwatch.backend.analysis.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nestwatch.backend.analysis.api.AnalysisPayload;
import com.nestwatch.backend.analysis.api.AnalysisProfile;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Extracts and validates the analysis object from raw provider text. Anything that does not match
 * the response schema is rejected with {@link InvalidAnalysisResponseException} so the gateway can
 * move on to the next provider.
 */
public class AnalysisResponseParser {

  private static final Pattern CODE_FENCE = Pattern.compile("(?m)^```(?:json)?\\s*$");
  private static final List<String> REQUIRED_FIELDS =
      List.of(
          "window",
          "totals",
          "by_priority",
          "by_source",
          "clusters",
          "top_events",
          "recommendations",
          "actions",
          "next_data_to_fetch");
  private static final List<String> ARRAY_FIELDS =
      List.of("clusters", "top_events", "recommendations", "actions", "next_data_to_fetch");
  private static final int MAX_RECOMMENDATIONS = 5;

  private final ObjectMapper objectMapper;
  private final int maxSummaryLines;

  public AnalysisResponseParser(ObjectMapper objectMapper, int maxSummaryLines) {
    this.objectMapper = objectMapper;
    this.maxSummaryLines = maxSummaryLines;
  }

  public ParsedAnalysis parse(String text, AnalysisProfile profile) {
    if (!StringUtils.hasText(text)) {
      throw new InvalidAnalysisResponseException("Empty provider response");
    }
    String cleaned = CODE_FENCE.matcher(text).replaceAll("").trim();
    int start = cleaned.indexOf('{');
    int end = cleaned.lastIndexOf('}');
    if (start < 0 || end < start) {
      throw new InvalidAnalysisResponseException("No JSON object found in provider response");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(cleaned.substring(start, end + 1));
    } catch (JsonProcessingException ex) {
      throw new InvalidAnalysisResponseException("Provider response is not valid JSON: " + ex.getOriginalMessage());
    }
    if (root == null || !root.isObject()) {
      throw new InvalidAnalysisResponseException("Provider response is not a JSON object");
    }
    ObjectNode object = (ObjectNode) root;
    validate(object);
    forceDryRun(object);

    AnalysisPayload payload;
    try {
      payload = objectMapper.treeToValue(object, AnalysisPayload.class);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new InvalidAnalysisResponseException("Provider response does not match the analysis schema: " + ex.getMessage());
    }
    if (payload.topEvents().size() > AnalysisPayload.MAX_TOP_EVENTS) {
      throw new InvalidAnalysisResponseException("top_events exceeds " + AnalysisPayload.MAX_TOP_EVENTS + " entries");
    }
    if (payload.recommendations().size() > MAX_RECOMMENDATIONS) {
      payload =
          new AnalysisPayload(
              payload.window(),
              payload.totals(),
              payload.byPriority(),
              payload.bySource(),
              payload.clusters(),
              payload.topEvents(),
              payload.recommendations().subList(0, MAX_RECOMMENDATIONS),
              payload.actions(),
              payload.nextDataToFetch());
    }

    String summary = null;
    if (profile == AnalysisProfile.CHAT) {
      summary = limitLines(cleaned.substring(end + 1));
    }
    return new ParsedAnalysis(payload, summary);
  }

  private void validate(ObjectNode object) {
    List<String> missing = new ArrayList<>();
    for (String field : REQUIRED_FIELDS) {
      if (!object.hasNonNull(field)) {
        missing.add(field);
      }
    }
    if (!missing.isEmpty()) {
      throw new InvalidAnalysisResponseException("Missing required fields: " + String.join(", ", missing));
    }
    if (!object.get("totals").canConvertToInt() || object.get("totals").asInt() < 0) {
      throw new InvalidAnalysisResponseException("totals must be a non-negative integer");
    }
    if (!object.get("by_priority").isObject() || !object.get("by_source").isObject()) {
      throw new InvalidAnalysisResponseException("by_priority and by_source must be objects");
    }
    for (String field : ARRAY_FIELDS) {
      if (!object.get(field).isArray()) {
        throw new InvalidAnalysisResponseException(field + " must be an array");
      }
    }
  }

  private void forceDryRun(ObjectNode object) {
    ArrayNode actions = (ArrayNode) object.get("actions");
    for (JsonNode action : actions) {
      if (!action.isObject()) {
        throw new InvalidAnalysisResponseException("actions must contain objects");
      }
      ((ObjectNode) action).put("dry_run", true);
    }
  }

  private String limitLines(String rest) {
    if (!StringUtils.hasText(rest)) {
      return null;
    }
    List<String> lines =
        Arrays.stream(rest.trim().split("\\R"))
            .map(String::strip)
            .filter(StringUtils::hasText)
            .limit(maxSummaryLines)
            .toList();
    return lines.isEmpty() ? null : String.join("\n", lines);
  }

  public record ParsedAnalysis(AnalysisPayload payload, String chatSummary) {}
}
