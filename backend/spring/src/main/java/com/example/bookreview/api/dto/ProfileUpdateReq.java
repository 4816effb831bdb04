package com.example.bookreview.api.dto;

import jakarta.validation.constraints.*;

public record ProfileUpdateReq(
  @NotBlank(message = "Name and email are required")
  @Size(max = 100, message = "Name must be at most 100 characters")
  String name,

  @NotBlank(message = "Name and email are required")
  @Email(message = "Email is not valid")
  @Size(max = 100, message = "Email must be at most 100 characters")
  String email
) {}
