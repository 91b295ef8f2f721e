package com.arganhr.adminauth.common.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Failed-attempt history of one login identifier.
 *
 * <p>Immutable: every attempt replaces the entry held by the limiter. {@code inFlight} counts
 * admitted attempts whose outcome has not been recorded yet.
 */
public record RateLimitEntry(
    int failureCount, int inFlight, Instant lastAttemptAt, Instant lockedUntil) {

  public RateLimitEntry {
    if (failureCount < 0) {
      throw new IllegalArgumentException("failureCount must not be negative");
    }
    if (inFlight < 0) {
      throw new IllegalArgumentException("inFlight must not be negative");
    }
    Objects.requireNonNull(lastAttemptAt, "lastAttemptAt is required");
    if (lockedUntil != null && lockedUntil.isBefore(lastAttemptAt)) {
      throw new IllegalArgumentException("lockedUntil must not precede lastAttemptAt");
    }
  }

  public boolean isLocked(Instant now) {
    return lockedUntil != null && now.isBefore(lockedUntil);
  }

  /** Inactive for longer than the window and not serving a lockout. */
  public boolean isStale(Instant now, Duration inactivityWindow) {
    return !isLocked(now) && Duration.between(lastAttemptAt, now).compareTo(inactivityWindow) > 0;
  }

  RateLimitEntry withInFlight(int value) {
    return new RateLimitEntry(failureCount, value, lastAttemptAt, lockedUntil);
  }
}
