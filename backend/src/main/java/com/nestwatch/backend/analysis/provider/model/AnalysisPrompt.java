package com.nestwatch.backend.analysis.provider.model;

import org.springframework.util.Assert;

public record AnalysisPrompt(String systemText, String userText) {

  public AnalysisPrompt {
    Assert.hasText(userText, "userText must not be blank");
    systemText = systemText != null ? systemText : "";
  }

  public String fullText() {
    return systemText.isEmpty() ? userText : systemText + "\n\n" + userText;
  }
}
