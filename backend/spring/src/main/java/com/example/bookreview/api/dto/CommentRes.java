package com.example.bookreview.api.dto;

import com.example.bookreview.domain.Comment;
import java.time.Instant;

public record CommentRes(
  Long id,
  Long reviewId,
  Long userId,
  String userName,
  String userEmail,
  String commentText,
  Instant createdAt
) {
  public static CommentRes from(Comment c) {
    return new CommentRes(c.getId(), c.getReview().getId(), c.getUser().getId(), c.getUser().getName(),
        c.getUser().getEmail(), c.getCommentText(), c.getCreatedAt());
  }
}
