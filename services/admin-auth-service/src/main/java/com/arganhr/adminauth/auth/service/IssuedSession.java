package com.arganhr.adminauth.auth.service;

/** A freshly signed session token together with the session it encodes. */
public record IssuedSession(String token, Session session) {

  @Override
  public String toString() {
    return "IssuedSession[session=" + session + "]";
  }
}
