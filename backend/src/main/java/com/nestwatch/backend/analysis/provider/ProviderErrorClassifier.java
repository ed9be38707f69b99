package com.nestwatch.backend.analysis.provider;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.web.client.RestClientResponseException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkServiceException;

/**
 * Maps vendor exceptions onto {@link ProviderErrorKind}. Walks the cause chain: Spring AI wraps
 * HTTP failures as {@code "<status> - <body>"} messages, the AWS SDK exposes status codes
 * directly.
 */
public final class ProviderErrorClassifier {

  private static final Pattern STATUS_PREFIX = Pattern.compile("^(\\d{3})\\s*-");
  private static final int MAX_CAUSE_DEPTH = 8;

  private static final List<String> QUOTA_MARKERS =
      List.of(
          "insufficient_quota",
          "quota exceeded",
          "exceeded your current quota",
          "billing details",
          "credit balance is too low");
  private static final List<String> RATE_MARKERS =
      List.of("rate limit", "rate_limit", "too many requests", "throttl");
  private static final List<String> AUTH_MARKERS =
      List.of("invalid api key", "invalid x-api-key", "incorrect api key", "unauthorized", "authentication_error");
  private static final List<String> TIMEOUT_MARKERS = List.of("timed out", "timeout");

  private ProviderErrorClassifier() {}

  public static ProviderException toProviderException(String provider, Throwable error) {
    if (error instanceof ProviderException providerException) {
      return providerException;
    }
    ProviderErrorKind kind = classify(error);
    String message = error != null && error.getMessage() != null ? error.getMessage() : kind.name();
    return new ProviderException(provider, kind, message, error);
  }

  public static ProviderErrorKind classify(Throwable error) {
    Throwable current = error;
    int depth = 0;
    ProviderErrorKind fromMessage = null;
    while (current != null && depth++ < MAX_CAUSE_DEPTH) {
      if (current instanceof ProviderException providerException) {
        return providerException.kind();
      }
      if (current instanceof TimeoutException
          || current instanceof SocketTimeoutException
          || current instanceof HttpTimeoutException
          || current instanceof ApiCallTimeoutException) {
        return ProviderErrorKind.TIMEOUT;
      }
      String message = lower(current.getMessage());
      if (current instanceof RestClientResponseException responseException) {
        return fromStatus(responseException.getStatusCode().value(), lower(responseException.getResponseBodyAsString()) + message);
      }
      if (current instanceof SdkServiceException serviceException) {
        if (serviceException.isThrottlingException()) {
          return containsAny(message, QUOTA_MARKERS)
              ? ProviderErrorKind.QUOTA_EXHAUSTED
              : ProviderErrorKind.RATE_LIMITED;
        }
        return fromStatus(serviceException.statusCode(), message);
      }
      Matcher matcher = STATUS_PREFIX.matcher(message.trim());
      if (matcher.find()) {
        return fromStatus(Integer.parseInt(matcher.group(1)), message);
      }
      if (fromMessage == null) {
        fromMessage = fromMessage(message);
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return fromMessage != null ? fromMessage : ProviderErrorKind.UNKNOWN;
  }

  static ProviderErrorKind fromStatus(int status, String message) {
    if (status == 429) {
      return containsAny(message, QUOTA_MARKERS)
          ? ProviderErrorKind.QUOTA_EXHAUSTED
          : ProviderErrorKind.RATE_LIMITED;
    }
    if (status == 402) {
      return ProviderErrorKind.QUOTA_EXHAUSTED;
    }
    if (status == 401 || status == 403) {
      return ProviderErrorKind.AUTH_FAILED;
    }
    if (status == 408 || status == 504) {
      return ProviderErrorKind.TIMEOUT;
    }
    ProviderErrorKind fromMessage = fromMessage(message);
    return fromMessage != null ? fromMessage : ProviderErrorKind.UNKNOWN;
  }

  private static ProviderErrorKind fromMessage(String message) {
    if (message.isEmpty()) {
      return null;
    }
    if (containsAny(message, QUOTA_MARKERS)) {
      return ProviderErrorKind.QUOTA_EXHAUSTED;
    }
    if (containsAny(message, RATE_MARKERS)) {
      return ProviderErrorKind.RATE_LIMITED;
    }
    if (containsAny(message, AUTH_MARKERS)) {
      return ProviderErrorKind.AUTH_FAILED;
    }
    if (containsAny(message, TIMEOUT_MARKERS)) {
      return ProviderErrorKind.TIMEOUT;
    }
    return null;
  }

  private static boolean containsAny(String message, List<String> markers) {
    for (String marker : markers) {
      if (message.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private static String lower(String value) {
    return value != null ? value.toLowerCase(Locale.ROOT) : "";
  }
}
