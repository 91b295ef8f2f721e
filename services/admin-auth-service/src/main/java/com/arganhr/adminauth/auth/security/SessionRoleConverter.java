package com.arganhr.adminauth.auth.security;

import java.util.Collection;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

/** Maps the session's {@code role} claim to a single {@code ROLE_<role>} authority. */
public class SessionRoleConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    Object claim = jwt.getClaim("role");
    if (claim == null) {
      return List.of();
    }
    String role = String.valueOf(claim).trim();
    if (role.isEmpty()) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority("ROLE_" + role));
  }
}
