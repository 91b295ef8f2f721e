package com.arganhr.adminauth.auth.api.dto;

public record OkResponse(boolean success, String message) {}
