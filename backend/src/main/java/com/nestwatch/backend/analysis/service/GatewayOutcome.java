package com.nestwatch.backend.analysis.service;

import com.nestwatch.backend.analysis.api.AnalysisResult;
import com.nestwatch.backend.analysis.api.FallbackReason;
import com.nestwatch.backend.analysis.provider.ProviderException;

/** Result of the live analysis path: a provider answer, a deliberate skip, or a chain failure. */
public interface GatewayOutcome {

  static GatewayOutcome ok(AnalysisResult result) {
    return new Ok(result);
  }

  static GatewayOutcome skip(FallbackReason reason) {
    return new Skip(reason);
  }

  static GatewayOutcome fail(ProviderException error) {
    return new Fail(error);
  }

  record Ok(AnalysisResult result) implements GatewayOutcome {}

  record Skip(FallbackReason reason) implements GatewayOutcome {}

  record Fail(ProviderException error) implements GatewayOutcome {}
}
