package com.arganhr.adminauth.auth.domain;

/** Security events written to the audit trail by the login flow. */
public enum AuditAction {
  LOGIN_SUCCESS,
  LOGIN_FAILED,
  LOGOUT
}
