package com.arganhr.adminauth.auth.api.dto;

import com.arganhr.adminauth.auth.domain.AdminRole;
import java.time.Instant;

public record SessionResponse(
    String adminId,
    String email,
    String name,
    AdminRole role,
    Instant issuedAt,
    Instant expiresAt) {}
