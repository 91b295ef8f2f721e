package com.arganhr.adminauth.auth.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Set;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Finds the session token in the {@code Authorization: Bearer} header or the session cookie.
 *
 * <p>Login and logout are answered without authentication: a stale token on those requests must
 * not turn into a 401, so the filter chain is given no token there.
 */
@Component
public class SessionTokenResolver implements BearerTokenResolver {

  private static final Set<String> UNAUTHENTICATED_PATHS =
      Set.of("/api/auth/login", "/api/auth/logout");

  private final DefaultBearerTokenResolver headerResolver = new DefaultBearerTokenResolver();
  private final SessionProperties props;

  public SessionTokenResolver(SessionProperties props) {
    this.props = props;
  }

  @Override
  public String resolve(HttpServletRequest request) {
    if (UNAUTHENTICATED_PATHS.contains(pathWithinApplication(request))) {
      return null;
    }
    String header = headerResolver.resolve(request);
    return header != null ? header : fromCookie(request);
  }

  /** Token for attribution only; malformed headers are ignored rather than rejected. */
  public String resolveQuietly(HttpServletRequest request) {
    String header;
    try {
      header = headerResolver.resolve(request);
    } catch (OAuth2AuthenticationException e) {
      header = null;
    }
    return header != null ? header : fromCookie(request);
  }

  private String fromCookie(HttpServletRequest request) {
    Cookie cookie = WebUtils.getCookie(request, props.cookieName());
    if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
      return null;
    }
    return cookie.getValue();
  }

  private static String pathWithinApplication(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String contextPath = request.getContextPath();
    if (uri == null) {
      return "";
    }
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
