package com.nestwatch.backend.analysis.fallback;

/** Raised when events are too malformed to summarize even without a language model. */
public class FallbackSummarizationException extends RuntimeException {

  public FallbackSummarizationException(String message) {
    super(message);
  }
}
