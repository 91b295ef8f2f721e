package com.arganhr.adminauth.auth.api.dto;

import java.time.Instant;

public record RefreshResponse(boolean success, String sessionToken, Instant expiresAt) {}
