package com.nestwatch.backend.analysis.provider.model;

public enum UsageSource {
  NATIVE,
  ESTIMATED,
  UNKNOWN
}
