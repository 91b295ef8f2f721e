package com.arganhr.adminauth.auth.repository;

import com.arganhr.adminauth.auth.domain.AuditAction;
import com.arganhr.adminauth.auth.domain.AuditLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, String> {

  List<AuditLogEntity> findByActionOrderByCreatedAtAsc(AuditAction action);
}
