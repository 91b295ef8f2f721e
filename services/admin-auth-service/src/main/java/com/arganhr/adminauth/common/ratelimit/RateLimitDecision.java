package com.arganhr.adminauth.common.ratelimit;

import java.time.Instant;
import java.util.Optional;

/** Admission verdict for a login identifier. {@code lockedUntil} is set only when denied. */
public record RateLimitDecision(boolean allowed, int remainingAttempts, Instant lockedUntil) {

  public static RateLimitDecision fresh(int threshold) {
    return new RateLimitDecision(true, threshold, null);
  }

  public Optional<Instant> lockedUntilOpt() {
    return Optional.ofNullable(lockedUntil);
  }
}
