package com.nestwatch.backend.analysis.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

@Schema(description = "Analysis request built by the dashboard from pre-fetched events")
public record AnalysisRequest(
    @NotNull(message = "events must be provided") @Size(max = 5000, message = "too many events")
        List<EventSnippet> events,
    AnalysisProfile profile,
    String requestType) {

  public RequestContext toContext() {
    return new RequestContext(events, profile, requestType);
  }
}
