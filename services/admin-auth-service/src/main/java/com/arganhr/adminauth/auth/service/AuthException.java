package com.arganhr.adminauth.auth.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single error type of the auth flow. Callers dispatch on {@link #getKind()}; the optional
 * details carry what the client may act on (remaining attempts, retry-after).
 */
public class AuthException extends RuntimeException {

  private final AuthErrorKind kind;
  private final Integer remainingAttempts;
  private final Long retryAfterSeconds;

  private AuthException(
      AuthErrorKind kind,
      String message,
      Integer remainingAttempts,
      Long retryAfterSeconds,
      Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.remainingAttempts = remainingAttempts;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public static AuthException invalidInput(String message) {
    return new AuthException(AuthErrorKind.INPUT_VALIDATION, message, null, null, null);
  }

  public static AuthException invalidCredentials(int remainingAttempts) {
    return new AuthException(
        AuthErrorKind.INVALID_CREDENTIALS,
        AuthErrorKind.INVALID_CREDENTIALS.defaultMessage(),
        remainingAttempts,
        null,
        null);
  }

  public static AuthException rateLimited(long retryAfterSeconds) {
    return new AuthException(
        AuthErrorKind.RATE_LIMITED,
        AuthErrorKind.RATE_LIMITED.defaultMessage(),
        null,
        retryAfterSeconds,
        null);
  }

  public static AuthException sessionInvalid() {
    return new AuthException(
        AuthErrorKind.SESSION_INVALID,
        AuthErrorKind.SESSION_INVALID.defaultMessage(),
        null,
        null,
        null);
  }

  public static AuthException infrastructure(String message, Throwable cause) {
    return new AuthException(AuthErrorKind.INFRASTRUCTURE, message, null, null, cause);
  }

  public AuthErrorKind getKind() {
    return kind;
  }

  public Integer getRemainingAttempts() {
    return remainingAttempts;
  }

  public Long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }

  public Map<String, Object> details() {
    Map<String, Object> out = new LinkedHashMap<>();
    if (remainingAttempts != null) {
      out.put("remainingAttempts", remainingAttempts);
    }
    if (retryAfterSeconds != null) {
      out.put("retryAfterSeconds", retryAfterSeconds);
    }
    return out;
  }
}
