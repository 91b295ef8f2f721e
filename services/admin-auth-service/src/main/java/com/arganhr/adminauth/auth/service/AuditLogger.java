package com.arganhr.adminauth.auth.service;

/**
 * Fire-and-forget sink for security events.
 *
 * <p>{@link #record} must not throw, block on the audit store, or otherwise affect the login or
 * logout it describes.
 */
public interface AuditLogger {
  void record(AuditEvent event);
}
