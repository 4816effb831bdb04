package com.example.bookreview.api.dto;

import com.example.bookreview.domain.Book;
import java.time.Instant;

public record BookRes(
  Long id,
  String title,
  String author,
  String isbn,
  String description,
  String coverImage,
  Integer publishedYear,
  String genre,
  Instant createdAt,
  Instant updatedAt
) {
  public static BookRes from(Book b) {
    return new BookRes(b.getId(), b.getTitle(), b.getAuthor(), b.getIsbn(), b.getDescription(),
        b.getCoverImage(), b.getPublishedYear(), b.getGenre(), b.getCreatedAt(), b.getUpdatedAt());
  }
}
