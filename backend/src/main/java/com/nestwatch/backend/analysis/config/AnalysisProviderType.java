package com.nestwatch.backend.analysis.config;

public enum AnalysisProviderType {
  BEDROCK,
  ANTHROPIC,
  OPENAI,
  LOCAL
}
