package com.example.bookreview.service;

import com.example.bookreview.exception.InvalidTokenException;
import com.example.bookreview.security.AuthUser;
import com.nimbusds.jose.*;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

@Slf4j
@Service
public class TokenService {
  private final String issuer;
  private final Duration lifetime;
  private final SecretKey signingKey;
  private final JwtDecoder decoder;

  public TokenService(@Value("${auth.issuer}") String issuer,
                      @Value("${auth.token-hours:24}") long tokenHours,
                      SecretKey signingKey,
                      JwtDecoder decoder) {
    this.issuer = issuer;
    this.lifetime = Duration.ofHours(tokenHours);
    this.signingKey = signingKey;
    this.decoder = decoder;
  }

  /**
   * Signs a token carrying the caller's id, email, name and role, valid for the configured lifetime.
   */
  public String issue(AuthUser claims) {
    Instant now = Instant.now();
    JWSHeader h = new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build();
    JWTClaimsSet body = new JWTClaimsSet.Builder()
        .issuer(issuer)
        .subject(String.valueOf(claims.id()))
        .issueTime(Date.from(now))
        .expirationTime(Date.from(now.plus(lifetime)))
        .claim(AuthUser.CLAIM_ID, claims.id())
        .claim(AuthUser.CLAIM_EMAIL, claims.email())
        .claim(AuthUser.CLAIM_NAME, claims.name())
        .claim(AuthUser.CLAIM_ROLE, claims.role().value())
        .build();
    SignedJWT jwt = new SignedJWT(h, body);
    try {
      jwt.sign(new MACSigner(signingKey));
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign token", e);
    }
    return jwt.serialize();
  }

  /**
   * Checks signature, issuer and expiry, then returns the embedded claims.
   *
   * @throws InvalidTokenException if any check fails or the claims are incomplete
   */
  public AuthUser verify(String token) {
    try {
      return AuthUser.from(decoder.decode(token));
    } catch (JwtException | IllegalArgumentException e) {
      log.debug("Token rejected: {}", e.getMessage());
      throw new InvalidTokenException();
    }
  }
}
