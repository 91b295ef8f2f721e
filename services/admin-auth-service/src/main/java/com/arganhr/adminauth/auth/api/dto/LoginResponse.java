package com.arganhr.adminauth.auth.api.dto;

public record LoginResponse(boolean success, String sessionToken, AdminProfileResponse admin) {}
