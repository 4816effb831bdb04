package com.example.bookreview.service;

import com.example.bookreview.api.dto.LoginReq;
import com.example.bookreview.api.dto.RegisterReq;
import com.example.bookreview.api.dto.TokenRes;
import com.example.bookreview.api.dto.UserRes;
import com.example.bookreview.domain.Role;
import com.example.bookreview.domain.User;
import com.example.bookreview.exception.EmailAlreadyExistsException;
import com.example.bookreview.exception.InvalidCredentialsException;
import com.example.bookreview.repo.UserRepo;
import com.example.bookreview.security.AuthUser;
import com.example.bookreview.util.PasswordValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Slf4j
@Service
public class AuthService {
  private final UserRepo users;
  private final PasswordEncoder encoder;
  private final TokenService tokens;

  public AuthService(UserRepo users, PasswordEncoder encoder, TokenService tokens) {
    this.users = users; this.encoder = encoder; this.tokens = tokens;
  }

  @Transactional
  public TokenRes register(RegisterReq req) {
    String email = normalizeEmail(req.email());
    if (users.existsByEmailIgnoreCase(email)) {
      log.info("Registration refused, {} already exists", email);
      throw new EmailAlreadyExistsException(EmailAlreadyExistsException.ON_REGISTER);
    }
    PasswordValidator.validate(req.password());

    User u = new User();
    u.setName(req.name().trim());
    u.setEmail(email);
    u.setPasswordHash(encoder.encode(req.password()));
    u.setRole(Role.USER);
    User saved = users.save(u);
    log.info("Registered user {} ({})", saved.getId(), email);

    return new TokenRes(tokens.issue(AuthUser.of(saved)), UserRes.from(saved));
  }

  @Transactional(readOnly = true)
  public TokenRes login(LoginReq req) {
    String email = normalizeEmail(req.email());
    User u = users.findByEmailIgnoreCase(email)
        .filter(x -> x.getPasswordHash() != null && encoder.matches(req.password(), x.getPasswordHash()))
        .orElseThrow(() -> {
          log.warn("Failed login for {}", email);
          return new InvalidCredentialsException();
        });
    log.info("User {} logged in", u.getId());
    return new TokenRes(tokens.issue(AuthUser.of(u)), UserRes.from(u));
  }

  static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
