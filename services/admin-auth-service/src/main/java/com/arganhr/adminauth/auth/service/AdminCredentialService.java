package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.auth.repository.AdminRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Looks up admin accounts and checks passwords.
 *
 * <p>{@link #authenticate} answers {@code null} for an unknown email, an inactive account and a
 * wrong password alike. Unknown emails are still run through BCrypt against a throwaway hash so
 * their response time matches a real account.
 */
@Service
@Slf4j
public class AdminCredentialService {

  private final AdminRepository admins;
  private final PasswordEncoder passwordEncoder;
  private final Executor authTaskExecutor;
  private final Clock clock;
  private final String dummyHash;

  public AdminCredentialService(
      AdminRepository admins,
      PasswordEncoder passwordEncoder,
      @Qualifier("authTaskExecutor") Executor authTaskExecutor,
      Clock clock) {
    this.admins = admins;
    this.passwordEncoder = passwordEncoder;
    this.authTaskExecutor = authTaskExecutor;
    this.clock = clock;
    this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
  }

  public Optional<AdminCredential> findByEmail(String email) {
    try {
      return admins.findByEmailIgnoreCase(email).map(AdminCredential::from);
    } catch (DataAccessException e) {
      throw AuthException.infrastructure("Credential store lookup failed", e);
    }
  }

  public Optional<AdminCredential> findActiveById(String adminId) {
    try {
      return admins.findByIdAndActiveTrue(adminId).map(AdminCredential::from);
    } catch (DataAccessException e) {
      throw AuthException.infrastructure("Credential store lookup failed", e);
    }
  }

  public boolean verifyPassword(String plaintext, String hash) {
    if (plaintext == null || hash == null || hash.isBlank()) {
      return false;
    }
    try {
      return passwordEncoder.matches(plaintext, hash);
    } catch (IllegalArgumentException e) {
      // e.g. passwords longer than BCrypt accepts
      return false;
    }
  }

  public AdminCredential authenticate(String email, String password) {
    Optional<AdminCredential> found = findByEmail(email);
    if (found.isEmpty()) {
      verifyPassword(password, dummyHash);
      return null;
    }

    AdminCredential admin = found.get();
    boolean passwordMatches = verifyPassword(password, admin.passwordHash());
    if (!passwordMatches || !admin.active()) {
      return null;
    }

    scheduleLastLoginUpdate(admin.id());
    return admin;
  }

  private void scheduleLastLoginUpdate(String adminId) {
    Instant now = clock.instant();
    try {
      authTaskExecutor.execute(
          () -> {
            try {
              admins.updateLastLogin(adminId, now);
            } catch (RuntimeException e) {
              log.warn("Failed to update last login for admin {}", adminId, e);
            }
          });
    } catch (RejectedExecutionException e) {
      log.warn("Last login update for admin {} dropped: executor saturated", adminId);
    }
  }
}
