package com.nestwatch.backend.analysis.controller;

import com.nestwatch.backend.analysis.api.AnalysisRequest;
import com.nestwatch.backend.analysis.api.AnalysisResult;
import com.nestwatch.backend.analysis.service.AnalysisGateway;
import com.nestwatch.backend.analysis.service.AnalysisStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sre/analysis")
@Validated
@Tag(name = "SRE Analysis", description = "LLM backed event analysis with deterministic fallback.")
public class AnalysisController {

  private final AnalysisGateway analysisGateway;
  private final AnalysisStatusService statusService;

  public AnalysisController(AnalysisGateway analysisGateway, AnalysisStatusService statusService) {
    this.analysisGateway = analysisGateway;
    this.statusService = statusService;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Analyze a batch of events.",
      description =
          "Returns a cached, live or rule-based analysis. The source field tells which one; fallback results carry a fallbackReason.")
  @ApiResponse(
      responseCode = "200",
      description = "Analysis of the supplied events.",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = AnalysisResult.class)))
  @ApiResponse(
      responseCode = "422",
      description = "Events are too malformed to be summarized.",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  public AnalysisResult analyze(@Valid @RequestBody AnalysisRequest request) {
    return analysisGateway.analyze(request.toContext());
  }

  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCache() {
    statusService.clearCache();
    return ResponseEntity.noContent().build();
  }
}
