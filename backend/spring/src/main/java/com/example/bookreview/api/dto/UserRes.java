package com.example.bookreview.api.dto;

import com.example.bookreview.domain.Role;
import com.example.bookreview.domain.User;
import java.time.Instant;

public record UserRes(Long id, String name, String email, Role role, Instant createdAt) {
  public static UserRes from(User u) {
    return new UserRes(u.getId(), u.getName(), u.getEmail(), u.getRole(), u.getCreatedAt());
  }
}
