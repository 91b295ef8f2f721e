package com.arganhr.adminauth.auth.repository;

import com.arganhr.adminauth.auth.domain.AdminEntity;
import jakarta.persistence.QueryHint;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.transaction.annotation.Transactional;

public interface AdminRepository extends JpaRepository<AdminEntity, String> {

  @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "3000"))
  Optional<AdminEntity> findByEmailIgnoreCase(String email);

  @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "3000"))
  Optional<AdminEntity> findByIdAndActiveTrue(String id);

  @Transactional(timeout = 5)
  @Modifying
  @Query("update AdminEntity a set a.lastLogin = ?2, a.updatedAt = ?2 where a.id = ?1")
  int updateLastLogin(String id, Instant at);
}
