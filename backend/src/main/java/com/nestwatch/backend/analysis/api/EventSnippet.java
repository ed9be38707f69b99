package com.nestwatch.backend.analysis.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

/**
 * Normalized event as supplied by the event proxy. Fields are not validated here; the fallback
 * summarizer rejects malformed snippets because it is the last degradation step.
 */
@Schema(description = "Normalized SRE event")
public record EventSnippet(
    String id,
    String source,
    EventPriority priority,
    @JsonAlias("summary") String shortSummary,
    Instant timestamp,
    String status) {}
