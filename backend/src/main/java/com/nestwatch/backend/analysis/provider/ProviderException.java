package com.nestwatch.backend.analysis.provider;

/** Failure of a single provider call. Recoverable: the gateway advances to the next provider. */
public class ProviderException extends RuntimeException {

  private final String provider;
  private final ProviderErrorKind kind;

  public ProviderException(String provider, ProviderErrorKind kind, String message) {
    this(provider, kind, message, null);
  }

  public ProviderException(String provider, ProviderErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.kind = kind != null ? kind : ProviderErrorKind.UNKNOWN;
  }

  public static ProviderException timeout(String provider, long timeoutMillis) {
    return new ProviderException(
        provider, ProviderErrorKind.TIMEOUT, "Provider call exceeded " + timeoutMillis + " ms");
  }

  public static ProviderException invalidResponse(String provider, String message) {
    return new ProviderException(provider, ProviderErrorKind.INVALID_RESPONSE, message);
  }

  public String provider() {
    return provider;
  }

  public ProviderErrorKind kind() {
    return kind;
  }
}
