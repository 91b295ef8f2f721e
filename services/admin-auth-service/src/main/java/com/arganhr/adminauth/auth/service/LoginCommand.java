package com.arganhr.adminauth.auth.service;

import com.arganhr.adminauth.common.web.ClientInfo;

public record LoginCommand(String email, String password, ClientInfo client) {

  @Override
  public String toString() {
    return "LoginCommand[email=" + email + ", client=" + client + "]";
  }
}
