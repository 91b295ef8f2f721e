package com.arganhr.adminauth.auth.service;

import org.springframework.http.HttpStatus;

/** Failure categories of the admin auth API, each with a stable code and HTTP status. */
public enum AuthErrorKind {
  INPUT_VALIDATION(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request data"),
  INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password"),
  RATE_LIMITED(
      HttpStatus.TOO_MANY_REQUESTS,
      "TOO_MANY_REQUESTS",
      "Too many login attempts. Please try again later."),
  SESSION_INVALID(
      HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Your session has expired. Please log in again."),
  INFRASTRUCTURE(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error");

  private final HttpStatus status;
  private final String code;
  private final String defaultMessage;

  AuthErrorKind(HttpStatus status, String code, String defaultMessage) {
    this.status = status;
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public HttpStatus status() {
    return status;
  }

  public String code() {
    return code;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
