package com.arganhr.adminauth.auth.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.arganhr.adminauth.auth.domain.AdminRole;
import com.arganhr.adminauth.auth.security.SecurityConfig;
import com.arganhr.adminauth.auth.security.SessionProperties;
import com.arganhr.adminauth.testsupport.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseCookie;
import org.springframework.security.oauth2.jwt.Jwt;

class SessionManagerTest {

  private static final String SECRET = "test-session-secret-test-session-secret";

  private static final AdminIdentity ADMIN =
      new AdminIdentity("admin-1", "a@x.com", AdminRole.ADMIN, "Alice");

  private MutableClock clock;
  private SessionManager sessions;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2025-10-01T10:00:00.250Z");
    sessions = managerWithSecret(SECRET);
  }

  private SessionManager managerWithSecret(String secret) {
    SessionProperties props =
        new SessionProperties(
            secret, "argan-hr-admin", Duration.ofHours(24), "admin_session", "/", true, "Lax");
    SecurityConfig config = new SecurityConfig();
    return new SessionManager(
        config.jwtEncoder(props), config.jwtDecoder(props, clock), props, clock);
  }

  @Test
  void create_thenValidate_returnsSameIdentity() {
    IssuedSession issued = sessions.create(ADMIN);

    Session session = sessions.validate(issued.token()).orElseThrow();

    assertThat(session.adminId()).isEqualTo("admin-1");
    assertThat(session.email()).isEqualTo("a@x.com");
    assertThat(session.role()).isEqualTo(AdminRole.ADMIN);
    assertThat(session.name()).isEqualTo("Alice");
    assertThat(session.issuedAt()).isEqualTo(Instant.parse("2025-10-01T10:00:00Z"));
    assertThat(session.expiresAt()).isEqualTo(Instant.parse("2025-10-02T10:00:00Z"));
    assertThat(session).isEqualTo(issued.session());
  }

  @Test
  void create_issuesDistinctTokensForSameAdmin() {
    assertThat(sessions.create(ADMIN).token()).isNotEqualTo(sessions.create(ADMIN).token());
  }

  @Test
  void validate_rejectsTamperedSignature() {
    String token = sessions.create(ADMIN).token();
    int sigStart = token.lastIndexOf('.') + 1;
    int pos = sigStart + 5;
    char replacement = token.charAt(pos) == 'A' ? 'B' : 'A';
    String tampered = token.substring(0, pos) + replacement + token.substring(pos + 1);

    assertThat(sessions.validate(tampered)).isEmpty();
  }

  @Test
  void validate_rejectsTamperedPayload() {
    String token = sessions.create(ADMIN).token();
    String[] parts = token.split("\\.");
    String forged =
        parts[0]
            + "."
            + java.util.Base64.getUrlEncoder()
                .withoutPadding()
                .encodeToString(
                    "{\"sub\":\"admin-1\",\"email\":\"a@x.com\",\"role\":\"SUPER_ADMIN\"}"
                        .getBytes(java.nio.charset.StandardCharsets.UTF_8))
            + "."
            + parts[2];

    assertThat(sessions.validate(forged)).isEmpty();
  }

  @Test
  void validate_rejectsExpiredToken() {
    String token = sessions.create(ADMIN).token();

    clock.advance(Duration.ofHours(23));
    assertThat(sessions.validate(token)).isPresent();

    clock.advance(Duration.ofHours(1));
    assertThat(sessions.validate(token)).isEmpty();
  }

  @Test
  void validate_rejectsMalformedOrMissingInput() {
    assertThat(sessions.validate(null)).isEmpty();
    assertThat(sessions.validate("")).isEmpty();
    assertThat(sessions.validate("not-a-jwt")).isEmpty();
    assertThat(sessions.validate("a.b.c")).isEmpty();
  }

  @Test
  void validate_rejectsTokenSignedWithOtherSecret() {
    SessionManager other = managerWithSecret("another-secret-another-secret-another");
    String foreign = other.create(ADMIN).token();

    assertThat(sessions.validate(foreign)).isEmpty();
  }

  @Test
  void toSession_rejectsUnknownRole() {
    Jwt jwt =
        Jwt.withTokenValue("t")
            .header("alg", "HS256")
            .subject("admin-1")
            .claim("email", "a@x.com")
            .claim("role", "ROOT")
            .issuedAt(clock.instant())
            .expiresAt(clock.instant().plusSeconds(60))
            .build();

    assertThat(sessions.toSession(jwt)).isEmpty();
  }

  @Test
  void sessionCookie_isHttpOnlyAndLivesUntilExpiry() {
    ResponseCookie cookie = sessions.sessionCookie(sessions.create(ADMIN));

    assertThat(cookie.getName()).isEqualTo("admin_session");
    assertThat(cookie.isHttpOnly()).isTrue();
    assertThat(cookie.isSecure()).isTrue();
    assertThat(cookie.getSameSite()).isEqualTo("Lax");
    assertThat(cookie.getPath()).isEqualTo("/");
    // expiry is truncated to whole seconds, the clock is 250ms past
    assertThat(cookie.getMaxAge()).isEqualTo(Duration.ofHours(24).minusMillis(250));
  }

  @Test
  void revoke_returnsExpiredEmptyCookie() {
    ResponseCookie cookie = sessions.revoke();

    assertThat(cookie.getName()).isEqualTo("admin_session");
    assertThat(cookie.getValue()).isEmpty();
    assertThat(cookie.getMaxAge()).isEqualTo(Duration.ZERO);
  }
}
