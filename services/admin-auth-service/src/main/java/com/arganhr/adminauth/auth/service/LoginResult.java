package com.arganhr.adminauth.auth.service;

/** Successful login: the issued session and the admin as read before this login. */
public record LoginResult(IssuedSession issuedSession, AdminCredential admin) {}
