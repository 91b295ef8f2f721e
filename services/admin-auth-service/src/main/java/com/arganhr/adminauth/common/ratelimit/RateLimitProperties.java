package com.arganhr.adminauth.common.ratelimit;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Brute-force limiter settings for admin logins.
 *
 * <p>Once an identifier has {@code failureThreshold} failures, each further failure locks it for
 * {@code baseDelay * 2^(failures - threshold)}, capped at {@code maxDelay}.
 */
@ConfigurationProperties(prefix = "admin-auth.rate-limit")
public record RateLimitProperties(
    @DefaultValue("3") int failureThreshold,
    @DefaultValue("PT5S") Duration baseDelay,
    @DefaultValue("PT1M") Duration maxDelay,
    @DefaultValue("PT15M") Duration inactivityWindow) {

  public RateLimitProperties {
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException("admin-auth.rate-limit.failure-threshold must be positive");
    }
    if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("admin-auth.rate-limit.base-delay must be positive");
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("admin-auth.rate-limit.max-delay must be >= base-delay");
    }
    if (inactivityWindow == null || inactivityWindow.isNegative() || inactivityWindow.isZero()) {
      throw new IllegalArgumentException(
          "admin-auth.rate-limit.inactivity-window must be positive");
    }
  }
}
