package com.example.bookreview.api.dto;

import com.example.bookreview.domain.Review;
import java.time.Instant;
import java.util.List;

public record ReviewRes(
  Long id,
  Long bookId,
  Long userId,
  String userName,
  String userEmail,
  int rating,
  String reviewText,
  long commentCount,
  List<ImageRes> images,
  Instant createdAt,
  Instant updatedAt
) {
  public static ReviewRes from(Review r, long commentCount, List<ImageRes> images) {
    return new ReviewRes(r.getId(), r.getBook().getId(), r.getUser().getId(), r.getUser().getName(),
        r.getUser().getEmail(), r.getRating(), r.getReviewText(), commentCount, images,
        r.getCreatedAt(), r.getUpdatedAt());
  }
}
