package com.example.bookreview.api.dto;

import jakarta.validation.constraints.*;

public record ImageReq(
  @NotBlank(message = "Image URL is required")
  @Size(max = 500, message = "Image URL must be at most 500 characters")
  String imageUrl,

  @Size(max = 255, message = "Image name must be at most 255 characters")
  String imageName
) {}
