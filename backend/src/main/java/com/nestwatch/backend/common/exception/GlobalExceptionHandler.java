package com.nestwatch.backend.common.exception;

import com.nestwatch.backend.analysis.fallback.FallbackSummarizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String INVALID_PAYLOAD = "Invalid request payload";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("The analysis gateway failed unexpectedly. Retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(FallbackSummarizationException.class)
  public ResponseEntity<ProblemDetail> handleFallbackFailure(FallbackSummarizationException ex) {
    log.warn("Rejected analysis request: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Events cannot be summarized");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.unprocessableEntity().body(problem);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableMessage(HttpMessageNotReadableException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Malformed request");
    problem.setDetail(INVALID_PAYLOAD);
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private String resolveValidationMessage(Exception ex) {
    // MethodArgumentNotValidException extends BindException
    if (ex instanceof BindException bindException) {
      return bindException.getBindingResult().getFieldErrors().stream()
          .findFirst()
          .map(error -> error.getField() + ": " + (error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid"))
          .orElse(INVALID_PAYLOAD);
    }
    return INVALID_PAYLOAD;
  }
}
