package com.example.bookreview.api.dto;

import jakarta.validation.constraints.*;

public record RegisterReq(
  @NotBlank(message = "Name is required")
  @Size(max = 100, message = "Name must be at most 100 characters")
  String name,

  @NotBlank(message = "Email is required")
  @Email(message = "Email is not valid")
  @Size(max = 100, message = "Email must be at most 100 characters")
  String email,

  @NotBlank(message = "Password is required")
  String password
) {}
