package com.nestwatch.backend.analysis.provider;

public enum ProviderErrorKind {
  RATE_LIMITED,
  QUOTA_EXHAUSTED,
  AUTH_FAILED,
  TIMEOUT,
  INVALID_RESPONSE,
  UNKNOWN
}
