package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.auth.domain.AuditAction;
import com.arganhr.adminauth.common.web.ClientInfo;
import java.time.Instant;

/**
 * One security event for the audit trail.
 *
 * @param adminId null when the caller's identity is unknown (failed logins)
 * @param reason failure reason code, null on success
 */
public record AuditEvent(
    AuditAction action,
    String adminId,
    String email,
    String ipAddress,
    String userAgent,
    Instant timestamp,
    boolean success,
    String reason) {

  public static AuditEvent loginSuccess(
      String adminId, String email, ClientInfo client, Instant at) {
    return new AuditEvent(
        AuditAction.LOGIN_SUCCESS,
        adminId,
        email,
        client.ipAddress(),
        client.userAgent(),
        at,
        true,
        null);
  }

  public static AuditEvent loginFailed(
      String email, ClientInfo client, Instant at, AuthErrorKind reason) {
    return new AuditEvent(
        AuditAction.LOGIN_FAILED,
        null,
        email,
        client.ipAddress(),
        client.userAgent(),
        at,
        false,
        reason.name());
  }

  public static AuditEvent logout(String adminId, String email, ClientInfo client, Instant at) {
    return new AuditEvent(
        AuditAction.LOGOUT, adminId, email, client.ipAddress(), client.userAgent(), at, true, null);
  }
}
