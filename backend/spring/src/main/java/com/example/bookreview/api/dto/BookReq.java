package com.example.bookreview.api.dto;

import jakarta.validation.constraints.*;

public record BookReq(
  @NotBlank(message = "Title and author are required")
  @Size(max = 255, message = "Title must be at most 255 characters")
  String title,

  @NotBlank(message = "Title and author are required")
  @Size(max = 255, message = "Author must be at most 255 characters")
  String author,

  @Size(max = 20, message = "ISBN must be at most 20 characters")
  String isbn,

  String description,

  Integer publishedYear,

  @Size(max = 100, message = "Genre must be at most 100 characters")
  String genre,

  @Size(max = 500, message = "Cover image URL must be at most 500 characters")
  String coverImage
) {}
