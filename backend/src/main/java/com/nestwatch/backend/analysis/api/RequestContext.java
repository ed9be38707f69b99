package com.nestwatch.backend.analysis.api;

import java.util.List;
import org.springframework.util.StringUtils;

public record RequestContext(List<EventSnippet> events, AnalysisProfile profile, String requestType) {

  public static final String DEFAULT_REQUEST_TYPE = "general";

  public RequestContext {
    // Stream.toList keeps null elements so the summarizer can report them
    events = events == null ? List.of() : events.stream().toList();
    profile = profile == null ? AnalysisProfile.JSON : profile;
    requestType = StringUtils.hasText(requestType) ? requestType.trim() : DEFAULT_REQUEST_TYPE;
  }

  public static RequestContext of(List<EventSnippet> events, AnalysisProfile profile) {
    return new RequestContext(events, profile, DEFAULT_REQUEST_TYPE);
  }
}
