package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.auth.domain.AdminRole;

/** Who a session is issued to. */
public record AdminIdentity(String adminId, String email, AdminRole role, String name) {

  public static AdminIdentity of(AdminCredential admin) {
    return new AdminIdentity(admin.id(), admin.email(), admin.role(), admin.name());
  }
}
