package com.nestwatch.backend.analysis.controller;

import com.nestwatch.backend.analysis.api.ProvidersStatusResponse;
import com.nestwatch.backend.analysis.api.UsageStatusResponse;
import com.nestwatch.backend.analysis.circuit.CircuitSnapshot;
import com.nestwatch.backend.analysis.service.AnalysisStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sre")
public class AnalysisStatusController {

  private final AnalysisStatusService statusService;

  public AnalysisStatusController(AnalysisStatusService statusService) {
    this.statusService = statusService;
  }

  @GetMapping("/usage")
  public UsageStatusResponse usage() {
    return statusService.usage();
  }

  @GetMapping("/providers")
  public ProvidersStatusResponse providers() {
    return statusService.providers();
  }

  @PostMapping("/providers/{provider}/circuit/reset")
  public CircuitSnapshot resetCircuit(@PathVariable String provider) {
    return statusService.resetCircuit(provider);
  }
}
