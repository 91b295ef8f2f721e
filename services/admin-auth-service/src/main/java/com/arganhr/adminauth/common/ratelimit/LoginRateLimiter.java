package com.arganhr.adminauth.common.ratelimit;

/**
 * Tracks failed logins per identifier (lower-cased email) and decides admission.
 *
 * <p>Implementations never throw into the login flow; they only return decisions. The in-memory
 * implementation is process-local; a shared store can replace it behind this interface.
 */
public interface LoginRateLimiter {

  /** Read-only view of the current verdict; reserves nothing. */
  RateLimitDecision checkAdmission(String identifier);

  /**
   * Admits one attempt and reserves it against the remaining budget in the same atomic step, so
   * parallel attempts never exceed the budget. An admitted attempt must be settled by {@link
   * #recordFailure}, {@link #recordSuccess} or {@link #release}.
   */
  RateLimitDecision tryAdmit(String identifier);

  /** Records a failed attempt and returns the decision that now applies to the identifier. */
  RateLimitDecision recordFailure(String identifier);

  /** Clears all history for the identifier. */
  void recordSuccess(String identifier);

  /** Gives back a reservation whose attempt ended without a verdict on the credentials. */
  void release(String identifier);

  /** Drops entries idle for longer than the inactivity window. Returns the number removed. */
  int purgeStale();
}
