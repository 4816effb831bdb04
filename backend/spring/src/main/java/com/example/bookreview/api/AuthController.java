package com.example.bookreview.api;

import com.example.bookreview.api.dto.*;
import com.example.bookreview.service.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class AuthController {
  private final AuthService auth;

  public AuthController(AuthService auth) {
    this.auth = auth;
  }

  @PostMapping("/register")
  public ResponseEntity<SuccessResponse<TokenRes>> register(@Valid @RequestBody RegisterReq req) {
    TokenRes res = auth.register(req);
    return ResponseEntity.status(HttpStatus.CREATED).body(SuccessResponse.of("User registered successfully", res));
  }

  @PostMapping("/login")
  public ResponseEntity<SuccessResponse<TokenRes>> login(@Valid @RequestBody LoginReq req) {
    return ResponseEntity.ok(SuccessResponse.of("Login successful", auth.login(req)));
  }
}
