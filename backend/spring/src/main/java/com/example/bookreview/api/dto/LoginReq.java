package com.example.bookreview.api.dto;

import jakarta.validation.constraints.*;

public record LoginReq(
  @NotBlank(message = "Email and password are required")
  String email,

  @NotBlank(message = "Email and password are required")
  String password
) {}
