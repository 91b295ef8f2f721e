package com.arganhr.adminauth.common.ratelimit;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Progressive-backoff login limiter kept in process memory.
 *
 * <p>Every mutation goes through {@link ConcurrentMap#compute} or {@link
 * ConcurrentMap#computeIfPresent}, which serialise updates of the same key; readers see a whole
 * immutable {@link RateLimitEntry}. Admission reserves its attempt inside the same per-key update
 * that checks the budget. The scheduled purge uses the same per-key operations.
 */
@Service
@Slf4j
public class InMemoryLoginRateLimiter implements LoginRateLimiter {

  // 2^30 * any sane base delay is already past every max delay
  private static final int MAX_EXPONENT = 30;

  private final ConcurrentMap<String, RateLimitEntry> entries = new ConcurrentHashMap<>();
  private final RateLimitProperties props;
  private final Clock clock;

  public InMemoryLoginRateLimiter(RateLimitProperties props, Clock clock) {
    this.props = props;
    this.clock = clock;
  }

  @Override
  public RateLimitDecision checkAdmission(String identifier) {
    Instant now = clock.instant();
    return verdict(live(entries.get(normalize(identifier)), now), now);
  }

  @Override
  public RateLimitDecision tryAdmit(String identifier) {
    String key = normalize(identifier);
    Instant now = clock.instant();
    AtomicReference<RateLimitDecision> result = new AtomicReference<>();
    entries.compute(
        key,
        (k, current) -> {
          RateLimitEntry entry = live(current, now);
          RateLimitDecision decision = verdict(entry, now);
          result.set(decision);
          if (!decision.allowed()) {
            return entry;
          }
          int failures = entry == null ? 0 : entry.failureCount();
          int inFlight = entry == null ? 0 : entry.inFlight();
          return new RateLimitEntry(failures, inFlight + 1, now, null);
        });
    return result.get();
  }

  @Override
  public RateLimitDecision recordFailure(String identifier) {
    String key = normalize(identifier);
    Instant now = clock.instant();
    RateLimitEntry updated =
        entries.compute(key, (k, current) -> nextFailure(current, now));

    if (updated.isLocked(now)) {
      log.warn(
          "Login identifier {} locked until {} after {} failed attempts",
          key,
          updated.lockedUntil(),
          updated.failureCount());
    }
    return decide(updated, now);
  }

  @Override
  public void recordSuccess(String identifier) {
    entries.remove(normalize(identifier));
  }

  @Override
  public void release(String identifier) {
    Instant now = clock.instant();
    entries.computeIfPresent(
        normalize(identifier),
        (k, entry) -> {
          int inFlight = Math.max(0, entry.inFlight() - 1);
          if (inFlight == 0 && entry.failureCount() == 0 && !entry.isLocked(now)) {
            return null;
          }
          return entry.withInFlight(inFlight);
        });
  }

  @Override
  public int purgeStale() {
    Instant now = clock.instant();
    int removed = 0;
    for (String key : entries.keySet()) {
      RateLimitEntry kept =
          entries.computeIfPresent(
              key, (k, entry) -> entry.isStale(now, props.inactivityWindow()) ? null : entry);
      if (kept == null) {
        removed++;
      }
    }
    return removed;
  }

  @Scheduled(fixedDelayString = "${admin-auth.rate-limit.purge-interval-ms:60000}")
  public void scheduledPurge() {
    int removed = purgeStale();
    if (removed > 0) {
      log.debug("Purged {} stale login rate-limit entries, {} remain", removed, entries.size());
    }
  }

  @PreDestroy
  public void shutdown() {
    entries.clear();
  }

  Optional<RateLimitEntry> entryFor(String identifier) {
    return Optional.ofNullable(entries.get(normalize(identifier)));
  }

  int trackedIdentifiers() {
    return entries.size();
  }

  private RateLimitEntry nextFailure(RateLimitEntry current, Instant now) {
    boolean expired = current == null || current.isStale(now, props.inactivityWindow());
    int failures = (expired ? 0 : current.failureCount()) + 1;
    int inFlight = expired ? 0 : Math.max(0, current.inFlight() - 1);

    Instant lockedUntil = null;
    if (failures >= props.failureThreshold()) {
      lockedUntil = now.plus(lockoutFor(failures));
      // a lockout already running is never shortened
      if (!expired && current.isLocked(now) && current.lockedUntil().isAfter(lockedUntil)) {
        lockedUntil = current.lockedUntil();
      }
    }
    return new RateLimitEntry(failures, inFlight, now, lockedUntil);
  }

  Duration lockoutFor(int failures) {
    int exponent = failures - props.failureThreshold();
    if (exponent < 0) {
      return Duration.ZERO;
    }
    if (exponent >= MAX_EXPONENT) {
      return props.maxDelay();
    }
    Duration delay = props.baseDelay().multipliedBy(1L << exponent);
    return delay.compareTo(props.maxDelay()) > 0 ? props.maxDelay() : delay;
  }

  private RateLimitEntry live(RateLimitEntry entry, Instant now) {
    return entry == null || entry.isStale(now, props.inactivityWindow()) ? null : entry;
  }

  /**
   * Denies while locked, or while the attempts already in flight use up what is left of the
   * budget. After a lockout ends one attempt at a time is admitted.
   */
  private RateLimitDecision verdict(RateLimitEntry entry, Instant now) {
    if (entry == null) {
      return RateLimitDecision.fresh(props.failureThreshold());
    }
    if (entry.isLocked(now)) {
      return decide(entry, now);
    }
    int allowance = Math.max(1, props.failureThreshold() - entry.failureCount());
    if (entry.inFlight() >= allowance) {
      return new RateLimitDecision(false, remaining(entry), null);
    }
    return new RateLimitDecision(true, remaining(entry), null);
  }

  private int remaining(RateLimitEntry entry) {
    return Math.max(0, props.failureThreshold() - entry.failureCount());
  }

  private RateLimitDecision decide(RateLimitEntry entry, Instant now) {
    if (entry.isLocked(now)) {
      return new RateLimitDecision(false, remaining(entry), entry.lockedUntil());
    }
    return new RateLimitDecision(true, remaining(entry), null);
  }

  private static String normalize(String identifier) {
    return identifier == null ? "unknown" : identifier.trim().toLowerCase(Locale.ROOT);
  }
}
