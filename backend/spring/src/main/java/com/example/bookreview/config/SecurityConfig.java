package com.example.bookreview.config;

import com.example.bookreview.crypto.SecretKeyLoader;
import com.example.bookreview.domain.Role;
import com.example.bookreview.security.AuthUser;
import com.example.bookreview.security.HeaderTokenResolver;
import com.example.bookreview.security.JsonSecurityErrorHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import javax.crypto.SecretKey;
import java.util.Collection;
import java.util.List;

import static org.springframework.security.web.util.matcher.AntPathRequestMatcher.antMatcher;

@Configuration
@EnableMethodSecurity
public class SecurityConfig {

  /** Routes served without the token guard. */
  public static final RequestMatcher PUBLIC_ENDPOINTS = new OrRequestMatcher(
      antMatcher("/health"),
      antMatcher("/error"),
      antMatcher(HttpMethod.POST, "/api/register"),
      antMatcher(HttpMethod.POST, "/api/login"),
      antMatcher(HttpMethod.GET, "/api/books"),
      antMatcher(HttpMethod.GET, "/api/books/*"),
      antMatcher(HttpMethod.GET, "/api/reviews/*/comments"),
      antMatcher(HttpMethod.GET, "/api/reviews/*/images")
  );

  @Bean PasswordEncoder passwordEncoder(){ return new BCryptPasswordEncoder(); }

  @Bean SecretKey tokenSigningKey(@Value("${auth.jwt-secret}") String secret) {
    return SecretKeyLoader.fromSecret(secret);
  }

  @Bean JwtDecoder jwtDecoder(SecretKey tokenSigningKey, @Value("${auth.issuer}") String issuer) {
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(tokenSigningKey)
        .macAlgorithm(MacAlgorithm.HS256)
        .build();
    decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(issuer));
    return decoder;
  }

  @Bean BearerTokenResolver tokenResolver(@Value("${auth.token-header:Authorization}") String header) {
    return new HeaderTokenResolver(header, PUBLIC_ENDPOINTS);
  }

  @Bean JwtAuthenticationConverter roleClaimConverter() {
    JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
    converter.setJwtGrantedAuthoritiesConverter(SecurityConfig::authoritiesOf);
    return converter;
  }

  static Collection<GrantedAuthority> authoritiesOf(Jwt jwt) {
    String role = jwt.getClaimAsString(AuthUser.CLAIM_ROLE);
    if (role == null) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority("ROLE_" + Role.fromValue(role).name()));
  }

  @Bean CorsConfigurationSource corsConfigurationSource(
      @Value("${app.cors.allowed-origins:*}") List<String> origins,
      @Value("${auth.token-header:Authorization}") String header) {
    CorsConfiguration cors = new CorsConfiguration();
    cors.setAllowedOriginPatterns(origins);
    cors.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    cors.setAllowedHeaders(List.of("Content-Type", header));
    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", cors);
    return source;
  }

  @Bean
  SecurityFilterChain filter(HttpSecurity http,
                             BearerTokenResolver tokenResolver,
                             JwtAuthenticationConverter roleClaimConverter,
                             JsonSecurityErrorHandler errors) throws Exception {
    http
      .csrf(csrf -> csrf.disable())
      .cors(cors -> {})
      .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
      .httpBasic(h -> h.disable())
      .formLogin(f -> f.disable())
      .authorizeHttpRequests(auth -> auth
        .requestMatchers(PUBLIC_ENDPOINTS).permitAll()
        .anyRequest().authenticated()
      )
      .exceptionHandling(ex -> ex
        .authenticationEntryPoint(errors)
        .accessDeniedHandler(errors))
      .oauth2ResourceServer(oauth -> oauth
        .bearerTokenResolver(tokenResolver)
        .authenticationEntryPoint(errors)
        .accessDeniedHandler(errors)
        .jwt(jwt -> jwt.jwtAuthenticationConverter(roleClaimConverter)));
    return http.build();
  }
}
