package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.auth.domain.AdminEntity;
import com.arganhr.adminauth.auth.domain.AdminRole;
import java.time.Instant;

/** Read-only view of an admin account as the login flow needs it. */
public record AdminCredential(
    String id,
    String email,
    String passwordHash,
    AdminRole role,
    String name,
    boolean active,
    Instant lastLogin) {

  public static AdminCredential from(AdminEntity entity) {
    return new AdminCredential(
        entity.getId(),
        entity.getEmail(),
        entity.getPasswordHash(),
        entity.getRole(),
        entity.getName(),
        entity.isActive(),
        entity.getLastLogin());
  }

  @Override
  public String toString() {
    return "AdminCredential[id=" + id + ", email=" + email + ", role=" + role + ", active="
        + active + "]";
  }
}
