package com.example.bookreview.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CommentReq(
  @NotBlank(message = "Comment text is required")
  String commentText
) {}
