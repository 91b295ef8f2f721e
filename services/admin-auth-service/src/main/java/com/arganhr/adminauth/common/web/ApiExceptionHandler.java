package com.arganhr.adminauth.common.web;

import com.arganhr.adminauth.auth.service.AuthErrorKind;
import com.arganhr.adminauth.auth.service.AuthException;
import com.arganhr.adminauth.auth.service.SessionManager;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class ApiExceptionHandler {

  private final SessionManager sessions;

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ErrorResponse> handleAuth(AuthException e) {
    AuthErrorKind kind = e.getKind();
    ResponseEntity.BodyBuilder response = ResponseEntity.status(kind.status());
    String message = e.getMessage();

    switch (kind) {
      case RATE_LIMITED -> {
        if (e.getRetryAfterSeconds() != null) {
          response.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
      }
      case SESSION_INVALID -> {
        response.header(HttpHeaders.SET_COOKIE, sessions.revoke().toString());
        log.debug("Session rejected: {}", e.getMessage());
      }
      case INFRASTRUCTURE -> {
        log.error("Auth infrastructure failure: {}", e.getMessage(), e);
        message = kind.defaultMessage();
      }
      default -> log.debug("Auth request rejected: kind={} details={}", kind, e.details());
    }

    return response.body(
        new ErrorResponse(
            false,
            kind.code(),
            message,
            e.getRemainingAttempts(),
            e.getRetryAfterSeconds(),
            Instant.now()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    return badRequest("Invalid request data");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return badRequest("Invalid request data");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handle500(Exception e) {
    log.error("Unhandled exception", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of(AuthErrorKind.INFRASTRUCTURE));
  }

  private static ResponseEntity<ErrorResponse> badRequest(String message) {
    return ResponseEntity.badRequest()
        .body(
            new ErrorResponse(
                false,
                AuthErrorKind.INPUT_VALIDATION.code(),
                message,
                null,
                null,
                Instant.now()));
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorResponse(
      boolean success,
      String code,
      String error,
      Integer remainingAttempts,
      Long retryAfterSeconds,
      Instant timestamp) {

    public static ErrorResponse of(AuthErrorKind kind) {
      return new ErrorResponse(false, kind.code(), kind.defaultMessage(), null, null, Instant.now());
    }
  }
}
