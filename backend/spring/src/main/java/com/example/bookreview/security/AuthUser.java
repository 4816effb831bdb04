package com.example.bookreview.security;

import com.example.bookreview.domain.Role;
import com.example.bookreview.domain.User;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Identity claims carried by a session token and attached to each authenticated request.
 */
public record AuthUser(Long id, String email, String name, Role role) {

  public static final String CLAIM_ID = "id";
  public static final String CLAIM_EMAIL = "email";
  public static final String CLAIM_NAME = "name";
  public static final String CLAIM_ROLE = "role";

  public static AuthUser of(User user) {
    return new AuthUser(user.getId(), user.getEmail(), user.getName(), user.getRole());
  }

  public static AuthUser from(Jwt jwt) {
    Object id = jwt.getClaim(CLAIM_ID);
    if (!(id instanceof Number number)) {
      throw new IllegalArgumentException("Token has no numeric id claim");
    }
    return new AuthUser(
        number.longValue(),
        jwt.getClaimAsString(CLAIM_EMAIL),
        jwt.getClaimAsString(CLAIM_NAME),
        Role.fromValue(jwt.getClaimAsString(CLAIM_ROLE)));
  }

  public boolean isAdmin() {
    return role == Role.ADMIN;
  }
}
