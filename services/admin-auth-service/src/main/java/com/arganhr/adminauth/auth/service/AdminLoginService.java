package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.common.ratelimit.LoginRateLimiter;
import com.arganhr.adminauth.common.ratelimit.RateLimitDecision;
import com.arganhr.adminauth.common.web.ClientInfo;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;

/**
 * Admin login and logout.
 *
 * <p>Login order is fixed: rate-limit admission, then the credential check, then either failure
 * bookkeeping or session issuance, and the audit write last. A locked identifier never reaches the
 * password check. Admission reserves the attempt, and every admitted attempt settles its
 * reservation exactly once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdminLoginService {

  static final int MAX_EMAIL_LENGTH = 254;
  // BCrypt only reads the first 72 bytes
  static final int MAX_PASSWORD_BYTES = 72;

  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

  private final LoginRateLimiter rateLimiter;
  private final AdminCredentialService credentials;
  private final SessionManager sessions;
  private final AuditLogger audit;
  private final Clock clock;

  public LoginResult login(LoginCommand command) {
    validate(command);
    String email = normalizeEmail(command.email());
    ClientInfo client = command.client() == null ? ClientInfo.unknown() : command.client();

    RateLimitDecision admission = rateLimiter.tryAdmit(email);
    if (!admission.allowed()) {
      long retryAfter = retryAfterSeconds(admission);
      log.info("Login for {} rejected by rate limiter, retry in {}s", email, retryAfter);
      audit.record(
          AuditEvent.loginFailed(email, client, clock.instant(), AuthErrorKind.RATE_LIMITED));
      throw AuthException.rateLimited(retryAfter);
    }

    AdminCredential admin;
    try {
      admin = credentials.authenticate(email, command.password());
    } catch (RuntimeException e) {
      rateLimiter.release(email);
      throw e;
    }
    if (admin == null) {
      RateLimitDecision after = rateLimiter.recordFailure(email);
      log.info("Login for {} failed, {} attempts before lockout", email, after.remainingAttempts());
      audit.record(
          AuditEvent.loginFailed(
              email, client, clock.instant(), AuthErrorKind.INVALID_CREDENTIALS));
      throw AuthException.invalidCredentials(after.remainingAttempts());
    }

    rateLimiter.recordSuccess(email);
    IssuedSession issued = sessions.create(AdminIdentity.of(admin));
    audit.record(AuditEvent.loginSuccess(admin.id(), admin.email(), client, clock.instant()));
    log.info("Admin {} logged in", admin.id());
    return new LoginResult(issued, admin);
  }

  /**
   * Always succeeds. A still-valid session is only used to attribute the audit entry; the returned
   * cookie clears the client token either way.
   */
  public ResponseCookie logout(String token, ClientInfo client) {
    Optional<Session> session = sessions.validate(token);
    session.ifPresent(
        s ->
            audit.record(
                AuditEvent.logout(
                    s.adminId(),
                    s.email(),
                    client == null ? ClientInfo.unknown() : client,
                    clock.instant())));
    return sessions.revoke();
  }

  /** Re-issues the session if the admin still exists and is active. */
  public IssuedSession refresh(Session current) {
    AdminCredential admin =
        credentials.findActiveById(current.adminId()).orElseThrow(AuthException::sessionInvalid);
    return sessions.create(AdminIdentity.of(admin));
  }

  private static void validate(LoginCommand command) {
    if (command == null) {
      throw AuthException.invalidInput("Email and password are required");
    }
    String email = command.email();
    String password = command.password();
    if (email == null || email.isBlank() || password == null || password.isEmpty()) {
      throw AuthException.invalidInput("Email and password are required");
    }
    String trimmed = email.trim();
    if (trimmed.length() > MAX_EMAIL_LENGTH || !EMAIL.matcher(trimmed).matches()) {
      throw AuthException.invalidInput("Invalid email format");
    }
    if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
      throw AuthException.invalidInput("Password is too long");
    }
  }

  private long retryAfterSeconds(RateLimitDecision decision) {
    Instant lockedUntil = decision.lockedUntilOpt().orElseGet(clock::instant);
    long millis = Duration.between(clock.instant(), lockedUntil).toMillis();
    return Math.max(1L, (millis + 999) / 1000);
  }

  static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
