package com.arganhr.adminauth.common.web;

import jakarta.servlet.http.HttpServletRequest;

/** Caller origin recorded on audit entries. */
public record ClientInfo(String ipAddress, String userAgent) {

  public static final String UNKNOWN = "unknown";

  public static ClientInfo unknown() {
    return new ClientInfo(UNKNOWN, UNKNOWN);
  }

  /** First X-Forwarded-For hop, then X-Real-IP, then the socket address. */
  public static ClientInfo from(HttpServletRequest request) {
    String ip = firstHop(request.getHeader("X-Forwarded-For"));
    if (ip == null) {
      ip = blankToNull(request.getHeader("X-Real-IP"));
    }
    if (ip == null) {
      ip = blankToNull(request.getRemoteAddr());
    }
    String userAgent = blankToNull(request.getHeader("User-Agent"));
    return new ClientInfo(ip == null ? UNKNOWN : ip, userAgent == null ? UNKNOWN : userAgent);
  }

  private static String firstHop(String forwardedFor) {
    String value = blankToNull(forwardedFor);
    if (value == null) {
      return null;
    }
    int comma = value.indexOf(',');
    return blankToNull(comma < 0 ? value : value.substring(0, comma));
  }

  private static String blankToNull(String s) {
    if (s == null) {
      return null;
    }
    String trimmed = s.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
