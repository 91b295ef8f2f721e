package com.arganhr.adminauth.auth.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.hibernate.Hibernate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Append-only audit row. Never updated or deleted by this service. */
@Entity
@Table(name = "audit_logs")
public class AuditLogEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  @Column(name = "id", nullable = false, updatable = false)
  private String id;

  // null for failed logins where the admin is unknown
  @Column(name = "admin_id", updatable = false)
  private String adminId;

  @Column(name = "entity_type", nullable = false, updatable = false)
  private String entityType;

  @Column(name = "entity_id", updatable = false)
  private String entityId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, length = 32, updatable = false)
  private AuditAction action;

  @Column(name = "changes", columnDefinition = "jsonb", updatable = false)
  @JdbcTypeCode(SqlTypes.JSON)
  private Map<String, Object> changes;

  @Column(name = "ip_address", updatable = false)
  private String ipAddress;

  @Column(name = "user_agent", updatable = false)
  private String userAgent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AuditLogEntity() {}

  public AuditLogEntity(
      String adminId,
      String entityType,
      AuditAction action,
      Map<String, Object> changes,
      String ipAddress,
      String userAgent,
      Instant createdAt) {
    this.adminId = adminId;
    this.entityType = entityType;
    this.action = action;
    this.changes = changes == null ? null : new LinkedHashMap<>(changes);
    this.ipAddress = ipAddress;
    this.userAgent = userAgent;
    this.createdAt = createdAt;
  }

  @PrePersist
  public void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public String getId() {
    return id;
  }

  public String getAdminId() {
    return adminId;
  }

  public String getEntityType() {
    return entityType;
  }

  public AuditAction getAction() {
    return action;
  }

  public Map<String, Object> getChanges() {
    return changes;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
    AuditLogEntity that = (AuditLogEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
