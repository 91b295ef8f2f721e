package com.arganhr.adminauth.auth.api.dto;

import com.arganhr.adminauth.auth.domain.AdminRole;
import java.time.Instant;

public record AdminProfileResponse(
    String id, String email, String name, AdminRole role, Instant lastLogin) {}
