package com.arganhr.adminauth.auth.domain;

public enum AdminRole {
  SUPER_ADMIN,
  ADMIN,
  VIEWER
}
