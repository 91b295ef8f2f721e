package com.arganhr.adminauth.auth.security;

import com.arganhr.adminauth.auth.service.AuthErrorKind;
import com.arganhr.adminauth.auth.service.SessionManager;
import com.arganhr.adminauth.common.web.ApiExceptionHandler.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers a missing, forged or expired session on a protected route with the API error body and a
 * cookie that clears the stale token.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final SessionManager sessions;
  private final ObjectMapper objectMapper;

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    log.debug(
        "Session rejected for {} {}: {}",
        request.getMethod(),
        request.getRequestURI(),
        authException.getMessage());

    AuthErrorKind kind = AuthErrorKind.SESSION_INVALID;
    response.setStatus(kind.status().value());
    response.addHeader(HttpHeaders.SET_COOKIE, sessions.revoke().toString());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(kind));
  }
}
