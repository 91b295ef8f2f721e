package com.arganhr.adminauth.auth.security;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
public class SecurityConfig {

  @Bean
  public SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      SessionTokenResolver sessionTokenResolver,
      SessionAuthenticationEntryPoint sessionEntryPoint)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/api/auth/login", "/api/auth/logout", "/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(sessionEntryPoint))
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .bearerTokenResolver(sessionTokenResolver)
                    .authenticationEntryPoint(sessionEntryPoint)
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(sessionAuthenticationConverter())));

    return http.build();
  }

  @Bean
  public JwtDecoder jwtDecoder(SessionProperties props, Clock clock) {
    NimbusJwtDecoder decoder =
        NimbusJwtDecoder.withSecretKey(hmacKey(props.secret()))
            .macAlgorithm(MacAlgorithm.HS256)
            .build();
    JwtTimestampValidator timestamps = new JwtTimestampValidator(Duration.ZERO);
    timestamps.setClock(clock);
    decoder.setJwtValidator(
        new DelegatingOAuth2TokenValidator<>(timestamps, new JwtIssuerValidator(props.issuer())));
    return decoder;
  }

  @Bean
  public JwtEncoder jwtEncoder(SessionProperties props) {
    return new NimbusJwtEncoder(new ImmutableSecret<>(hmacKey(props.secret())));
  }

  @Bean
  public PasswordEncoder passwordEncoder(
      @Value("${admin-auth.password.bcrypt-strength:12}") int strength) {
    return new BCryptPasswordEncoder(strength);
  }

  static JwtAuthenticationConverter sessionAuthenticationConverter() {
    JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
    converter.setJwtGrantedAuthoritiesConverter(new SessionRoleConverter());
    return converter;
  }

  static SecretKey hmacKey(String secret) {
    if (secret == null) {
      throw new IllegalStateException("admin-auth.session.secret is not configured");
    }
    byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < 32) {
      throw new IllegalStateException(
          "admin-auth.session.secret is too short. Provide at least 32 bytes.");
    }
    return new SecretKeySpec(bytes, "HmacSHA256");
  }
}
