package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.auth.domain.AdminRole;
import com.arganhr.adminauth.auth.security.SessionProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseCookie;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.stereotype.Service;

/**
 * Issues and validates stateless admin sessions.
 *
 * <p>A session is an HS256-signed JWT; the server keeps no per-session state, so validation is a
 * pure function of the token, the secret and the clock. Expiry is fixed when the token is issued
 * and does not slide; refreshing means issuing a new token.
 */
@Service
@Slf4j
public class SessionManager {

  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_NAME = "name";

  private final JwtEncoder jwtEncoder;
  private final JwtDecoder jwtDecoder;
  private final SessionProperties props;
  private final Clock clock;

  public SessionManager(
      JwtEncoder jwtEncoder, JwtDecoder jwtDecoder, SessionProperties props, Clock clock) {
    this.jwtEncoder = jwtEncoder;
    this.jwtDecoder = jwtDecoder;
    this.props = props;
    this.clock = clock;
  }

  public IssuedSession create(AdminIdentity admin) {
    // JWT time claims have second precision
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(props.ttl());

    JwtClaimsSet claims =
        JwtClaimsSet.builder()
            .id(UUID.randomUUID().toString())
            .issuer(props.issuer())
            .subject(admin.adminId())
            .issuedAt(now)
            .expiresAt(expiresAt)
            .claim(CLAIM_EMAIL, admin.email())
            .claim(CLAIM_ROLE, admin.role().name())
            .claim(CLAIM_NAME, admin.name())
            .build();

    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();

    Session session =
        new Session(admin.adminId(), admin.email(), admin.role(), admin.name(), now, expiresAt);
    return new IssuedSession(token, session);
  }

  /** Empty for a missing, malformed, forged or expired token. Never throws. */
  public Optional<Session> validate(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      return toSession(jwtDecoder.decode(token));
    } catch (JwtException e) {
      log.debug("Rejected session token: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public Optional<Session> toSession(Jwt jwt) {
    String adminId = jwt.getSubject();
    String email = jwt.getClaimAsString(CLAIM_EMAIL);
    String role = jwt.getClaimAsString(CLAIM_ROLE);
    Instant issuedAt = jwt.getIssuedAt();
    Instant expiresAt = jwt.getExpiresAt();
    if (adminId == null || email == null || role == null || expiresAt == null) {
      return Optional.empty();
    }

    AdminRole adminRole;
    try {
      adminRole = AdminRole.valueOf(role);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }

    Session session =
        new Session(adminId, email, adminRole, jwt.getClaimAsString(CLAIM_NAME), issuedAt, expiresAt);
    if (session.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(session);
  }

  public ResponseCookie sessionCookie(IssuedSession issued) {
    Duration maxAge = Duration.between(clock.instant(), issued.session().expiresAt());
    return cookie(issued.token(), maxAge.isNegative() ? Duration.ZERO : maxAge);
  }

  /** Clears the client-held token with an already-expired cookie. */
  public ResponseCookie revoke() {
    return cookie("", Duration.ZERO);
  }

  public String cookieName() {
    return props.cookieName();
  }

  private ResponseCookie cookie(String value, Duration maxAge) {
    return ResponseCookie.from(props.cookieName(), value)
        .httpOnly(true)
        .secure(props.cookieSecure())
        .sameSite(props.cookieSameSite())
        .path(props.cookiePath())
        .maxAge(maxAge)
        .build();
  }
}
