package com.example.bookreview.api;

import com.example.bookreview.api.dto.ProfileUpdateReq;
import com.example.bookreview.api.dto.SuccessResponse;
import com.example.bookreview.api.dto.UserRes;
import com.example.bookreview.security.AdminOnly;
import com.example.bookreview.security.AuthUser;
import com.example.bookreview.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class UserController {
  private final UserService users;

  public UserController(UserService users) {
    this.users = users;
  }

  @GetMapping("/profile")
  public ResponseEntity<SuccessResponse<UserRes>> profile(@AuthenticationPrincipal Jwt jwt) {
    UserRes user = users.getProfile(AuthUser.from(jwt).id());
    return ResponseEntity.ok(SuccessResponse.of("Profile loaded", user));
  }

  @PutMapping("/profile")
  public ResponseEntity<SuccessResponse<UserRes>> updateProfile(@AuthenticationPrincipal Jwt jwt,
                                                                @Valid @RequestBody ProfileUpdateReq req) {
    UserRes user = users.updateProfile(AuthUser.from(jwt), req);
    return ResponseEntity.ok(SuccessResponse.of("Profile updated successfully", user));
  }

  @GetMapping("/dashboard")
  public ResponseEntity<SuccessResponse<UserRes>> dashboard(@AuthenticationPrincipal Jwt jwt) {
    UserRes user = users.getProfile(AuthUser.from(jwt).id());
    return ResponseEntity.ok(SuccessResponse.of("Dashboard loaded", user));
  }

  @AdminOnly
  @GetMapping("/users")
  public ResponseEntity<SuccessResponse<List<UserRes>>> listUsers() {
    return ResponseEntity.ok(SuccessResponse.of("Users loaded", users.listUsers()));
  }
}
