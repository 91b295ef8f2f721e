package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.auth.domain.AdminRole;
import java.time.Instant;

/** Authenticated admin identity carried by a signed session token. Never mutated in place. */
public record Session(
    String adminId,
    String email,
    AdminRole role,
    String name,
    Instant issuedAt,
    Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }
}
