package com.nestwatch.backend.analysis.prompt;

public class InvalidAnalysisResponseException extends RuntimeException {

  public InvalidAnalysisResponseException(String message) {
    super(message);
  }
}
