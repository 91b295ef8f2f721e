package com.arganhr.adminauth.auth.api;

import com.arganhr.adminauth.auth.api.dto.LoginRequest;
import com.arganhr.adminauth.auth.api.dto.LoginResponse;
import com.arganhr.adminauth.auth.api.dto.OkResponse;
import com.arganhr.adminauth.auth.api.dto.RefreshResponse;
import com.arganhr.adminauth.auth.api.dto.SessionResponse;
import com.arganhr.adminauth.auth.api.mapper.AdminAuthApiMapper;
import com.arganhr.adminauth.auth.security.SessionTokenResolver;
import com.arganhr.adminauth.auth.service.AdminLoginService;
import com.arganhr.adminauth.auth.service.AuthException;
import com.arganhr.adminauth.auth.service.IssuedSession;
import com.arganhr.adminauth.auth.service.LoginCommand;
import com.arganhr.adminauth.auth.service.LoginResult;
import com.arganhr.adminauth.auth.service.Session;
import com.arganhr.adminauth.auth.service.SessionManager;
import com.arganhr.adminauth.common.web.ClientInfo;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AdminAuthController {

  static final String LOGIN_PAGE = "/admin/login";

  private final AdminLoginService loginService;
  private final SessionManager sessions;
  private final SessionTokenResolver tokenResolver;
  private final AdminAuthApiMapper mapper;

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(
      @Valid @RequestBody LoginRequest request, HttpServletRequest http) {
    LoginResult result =
        loginService.login(
            new LoginCommand(request.email(), request.password(), ClientInfo.from(http)));
    IssuedSession issued = result.issuedSession();

    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, sessions.sessionCookie(issued).toString())
        .body(new LoginResponse(true, issued.token(), mapper.toProfile(result.admin())));
  }

  /** Idempotent: succeeds with or without a valid session. */
  @PostMapping("/logout")
  public ResponseEntity<OkResponse> logout(HttpServletRequest http) {
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, clearSession(http).toString())
        .body(new OkResponse(true, "Logged out successfully"));
  }

  /** Link-style logout: same as POST, then sends the browser to the login page. */
  @GetMapping("/logout")
  public ResponseEntity<Void> logoutAndRedirect(HttpServletRequest http) {
    return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
        .header(HttpHeaders.SET_COOKIE, clearSession(http).toString())
        .location(URI.create(LOGIN_PAGE))
        .build();
  }

  @GetMapping("/session")
  public SessionResponse currentSession(@AuthenticationPrincipal Jwt jwt) {
    return mapper.toSessionResponse(requireSession(jwt));
  }

  @PostMapping("/refresh")
  public ResponseEntity<RefreshResponse> refresh(@AuthenticationPrincipal Jwt jwt) {
    IssuedSession issued = loginService.refresh(requireSession(jwt));
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, sessions.sessionCookie(issued).toString())
        .body(new RefreshResponse(true, issued.token(), issued.session().expiresAt()));
  }

  private ResponseCookie clearSession(HttpServletRequest http) {
    return loginService.logout(tokenResolver.resolveQuietly(http), ClientInfo.from(http));
  }

  private Session requireSession(Jwt jwt) {
    if (jwt == null) {
      throw AuthException.sessionInvalid();
    }
    return sessions.toSession(jwt).orElseThrow(AuthException::sessionInvalid);
  }
}
