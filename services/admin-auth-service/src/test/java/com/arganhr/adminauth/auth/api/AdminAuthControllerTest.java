package com.arganhr.adminauth.auth.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.arganhr.adminauth.auth.api.mapper.AdminAuthApiMapper;
import com.arganhr.adminauth.auth.domain.AdminRole;
import com.arganhr.adminauth.auth.security.SecurityConfig;
import com.arganhr.adminauth.auth.security.SessionProperties;
import com.arganhr.adminauth.auth.security.SessionTokenResolver;
import com.arganhr.adminauth.auth.service.AdminCredential;
import com.arganhr.adminauth.auth.service.AdminIdentity;
import com.arganhr.adminauth.auth.service.AdminLoginService;
import com.arganhr.adminauth.auth.service.AuthException;
import com.arganhr.adminauth.auth.service.IssuedSession;
import com.arganhr.adminauth.auth.service.LoginCommand;
import com.arganhr.adminauth.auth.service.LoginResult;
import com.arganhr.adminauth.auth.service.Session;
import com.arganhr.adminauth.auth.service.SessionManager;
import com.arganhr.adminauth.common.web.ApiExceptionHandler;
import com.arganhr.adminauth.common.web.ClientInfo;
import jakarta.servlet.http.Cookie;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AdminAuthControllerTest {

  private static final AdminCredential ALICE =
      new AdminCredential(
          "admin-1",
          "a@x.com",
          "$2a$12$never-serialised",
          AdminRole.SUPER_ADMIN,
          "Alice",
          true,
          Instant.parse("2025-09-30T08:00:00Z"));

  private AdminLoginService loginService;
  private SessionManager sessions;
  private JwtDecoder decoder;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    SessionProperties props =
        new SessionProperties(
            "controller-test-secret-controller-test-secret",
            "argan-hr-admin",
            Duration.ofHours(24),
            "admin_session",
            "/",
            true,
            "Lax");
    Clock clock = Clock.systemUTC();
    SecurityConfig security = new SecurityConfig();
    decoder = security.jwtDecoder(props, clock);
    sessions = new SessionManager(security.jwtEncoder(props), decoder, props, clock);
    loginService = mock(AdminLoginService.class);

    AdminAuthController controller =
        new AdminAuthController(
            loginService,
            sessions,
            new SessionTokenResolver(props),
            Mappers.getMapper(AdminAuthApiMapper.class));
    mvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler(sessions))
            .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
            .build();
  }

  @AfterEach
  void clearSecurityContext() {
    SecurityContextHolder.clearContext();
  }

  private static String loginBody(String email, String password) {
    return "{\"email\":\"" + email + "\",\"password\":\"" + password + "\"}";
  }

  @Test
  void login_returnsTokenProfileAndSessionCookie() throws Exception {
    IssuedSession issued = sessions.create(AdminIdentity.of(ALICE));
    when(loginService.login(any())).thenReturn(new LoginResult(issued, ALICE));

    mvc.perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                .header("User-Agent", "junit")
                .content(loginBody("a@x.com", "right-pass")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.sessionToken").value(issued.token()))
        .andExpect(jsonPath("$.admin.id").value("admin-1"))
        .andExpect(jsonPath("$.admin.role").value("SUPER_ADMIN"))
        .andExpect(jsonPath("$.admin.passwordHash").doesNotExist())
        .andExpect(header().string("Set-Cookie", containsString("admin_session=" + issued.token())))
        .andExpect(header().string("Set-Cookie", containsString("HttpOnly")));

    ArgumentCaptor<LoginCommand> command = ArgumentCaptor.forClass(LoginCommand.class);
    verify(loginService).login(command.capture());
    assertThat(command.getValue().email()).isEqualTo("a@x.com");
    assertThat(command.getValue().client()).isEqualTo(new ClientInfo("203.0.113.7", "junit"));
  }

  @Test
  void login_invalidCredentials_reportsRemainingAttempts() throws Exception {
    when(loginService.login(any())).thenThrow(AuthException.invalidCredentials(2));

    mvc.perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginBody("a@x.com", "wrong")))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
        .andExpect(jsonPath("$.error").value("Invalid email or password"))
        .andExpect(jsonPath("$.remainingAttempts").value(2))
        .andExpect(jsonPath("$.retryAfterSeconds").doesNotExist());
  }

  @Test
  void login_rateLimited_setsRetryAfter() throws Exception {
    when(loginService.login(any())).thenThrow(AuthException.rateLimited(5));

    mvc.perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginBody("a@x.com", "right-pass")))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().string("Retry-After", "5"))
        .andExpect(jsonPath("$.code").value("TOO_MANY_REQUESTS"))
        .andExpect(jsonPath("$.retryAfterSeconds").value(5));
  }

  @Test
  void login_invalidBody_isRejectedBeforeTheService() throws Exception {
    mvc.perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"not-an-email\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

    mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON).content("{oops"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

    verify(loginService, never()).login(any());
  }

  @Test
  void login_infrastructureFailure_hidesInternalMessage() throws Exception {
    when(loginService.login(any()))
        .thenThrow(AuthException.infrastructure("Credential store lookup failed", null));

    mvc.perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(loginBody("a@x.com", "right-pass")))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.error").value("Unexpected error"));
  }

  @Test
  void logout_passesCookieTokenAndClearsCookie() throws Exception {
    when(loginService.logout(eq("cookie-token"), any())).thenReturn(sessions.revoke());

    mvc.perform(post("/api/auth/logout").cookie(new Cookie("admin_session", "cookie-token")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.message").value("Logged out successfully"))
        .andExpect(header().string("Set-Cookie", containsString("Max-Age=0")));
  }

  @Test
  void logout_withoutSession_stillSucceeds() throws Exception {
    when(loginService.logout(isNull(), any())).thenReturn(sessions.revoke());

    mvc.perform(post("/api/auth/logout"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true));
    mvc.perform(post("/api/auth/logout").header("Authorization", "Bearer "))
        .andExpect(status().isOk());
  }

  @Test
  void logoutViaGet_clearsCookieAndRedirectsToLoginPage() throws Exception {
    when(loginService.logout(eq("cookie-token"), any())).thenReturn(sessions.revoke());

    mvc.perform(get("/api/auth/logout").cookie(new Cookie("admin_session", "cookie-token")))
        .andExpect(status().isTemporaryRedirect())
        .andExpect(header().string("Location", "/admin/login"))
        .andExpect(header().string("Set-Cookie", containsString("Max-Age=0")));

    verify(loginService).logout(eq("cookie-token"), any());
  }

  @Test
  void session_returnsAuthenticatedIdentity() throws Exception {
    authenticateAs(sessions.create(AdminIdentity.of(ALICE)));

    mvc.perform(get("/api/auth/session"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.adminId").value("admin-1"))
        .andExpect(jsonPath("$.email").value("a@x.com"))
        .andExpect(jsonPath("$.role").value("SUPER_ADMIN"));
  }

  @Test
  void session_withoutPrincipal_isUnauthorized() throws Exception {
    mvc.perform(get("/api/auth/session"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
        .andExpect(header().string("Set-Cookie", containsString("admin_session=;")))
        .andExpect(header().string("Set-Cookie", containsString("Max-Age=0")));
  }

  @Test
  void refresh_returnsNewTokenAndCookie() throws Exception {
    IssuedSession current = sessions.create(AdminIdentity.of(ALICE));
    IssuedSession renewed = sessions.create(AdminIdentity.of(ALICE));
    authenticateAs(current);
    when(loginService.refresh(any(Session.class))).thenReturn(renewed);

    mvc.perform(post("/api/auth/refresh"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.sessionToken").value(renewed.token()))
        .andExpect(header().string("Set-Cookie", containsString(renewed.token())));
  }

  private void authenticateAs(IssuedSession issued) {
    Jwt jwt = decoder.decode(issued.token());
    SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
  }
}
