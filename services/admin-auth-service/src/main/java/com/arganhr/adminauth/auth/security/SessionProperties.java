package com.arganhr.adminauth.auth.security;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "admin-auth.session")
public record SessionProperties(
    String secret,
    @DefaultValue("argan-hr-admin") String issuer,
    @DefaultValue("PT24H") Duration ttl,
    @DefaultValue("admin_session") String cookieName,
    @DefaultValue("/") String cookiePath,
    @DefaultValue("true") boolean cookieSecure,
    @DefaultValue("Lax") String cookieSameSite) {

  public SessionProperties {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("admin-auth.session.ttl must be positive");
    }
  }
}
