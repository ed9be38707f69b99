package com.nestwatch.backend.analysis.api;

import com.nestwatch.backend.analysis.circuit.CircuitState;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Configured analysis providers in chain order")
public record ProvidersStatusResponse(List<String> chain, List<ProviderStatus> providers) {

  public record ProviderStatus(
      String name, String model, boolean inChain, boolean healthy, CircuitState circuitState) {}
}
