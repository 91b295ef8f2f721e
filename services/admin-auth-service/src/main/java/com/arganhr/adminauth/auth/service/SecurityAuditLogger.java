package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.auth.domain.AuditLogEntity;
import com.arganhr.adminauth.auth.repository.AuditLogRepository;
import com.arganhr.adminauth.config.AuthTaskProperties;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Writes audit events to {@code audit_logs} on the auth task executor.
 *
 * <p>One write attempt per event. Failures, timeouts and executor rejections go to the
 * operational log only. A write that outlives the timeout is left to finish on its own.
 */
@Service
@Slf4j
public class SecurityAuditLogger implements AuditLogger {

  static final String ENTITY_TYPE = "authentication";

  private final AuditLogRepository auditLogRepository;
  private final Executor authTaskExecutor;
  private final Duration writeTimeout;

  public SecurityAuditLogger(
      AuditLogRepository auditLogRepository,
      @Qualifier("authTaskExecutor") Executor authTaskExecutor,
      AuthTaskProperties props) {
    this.auditLogRepository = auditLogRepository;
    this.authTaskExecutor = authTaskExecutor;
    this.writeTimeout = props.auditWriteTimeout();
  }

  @Override
  public void record(AuditEvent event) {
    try {
      CompletableFuture.runAsync(() -> auditLogRepository.save(toEntity(event)), authTaskExecutor)
          .orTimeout(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)
          .whenComplete(
              (ignored, error) -> {
                if (error != null) {
                  log.warn(
                      "Failed to write audit entry action={} adminId={}",
                      event.action(),
                      event.adminId(),
                      error);
                }
              });
    } catch (RuntimeException e) {
      log.warn(
          "Audit entry action={} adminId={} dropped: {}",
          event.action(),
          event.adminId(),
          e.toString());
    }
  }

  static AuditLogEntity toEntity(AuditEvent event) {
    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put("email", event.email());
    changes.put("success", event.success());
    changes.put("timestamp", event.timestamp().toString());
    if (event.reason() != null) {
      changes.put("reason", event.reason());
    }
    return new AuditLogEntity(
        event.adminId(),
        ENTITY_TYPE,
        event.action(),
        changes,
        event.ipAddress(),
        event.userAgent(),
        event.timestamp());
  }
}
