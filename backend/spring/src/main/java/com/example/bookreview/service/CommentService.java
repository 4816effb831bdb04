package com.example.bookreview.service;

import com.example.bookreview.api.dto.CommentRes;
import com.example.bookreview.domain.Comment;
import com.example.bookreview.domain.Review;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.exception.ValidationException;
import com.example.bookreview.repo.CommentRepo;
import com.example.bookreview.repo.ReviewRepo;
import com.example.bookreview.repo.UserRepo;
import com.example.bookreview.security.AuthUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Slf4j
@Service
public class CommentService {
  private final CommentRepo comments;
  private final ReviewRepo reviews;
  private final UserRepo users;
  private final OwnershipPolicy ownership;

  public CommentService(CommentRepo comments, ReviewRepo reviews, UserRepo users, OwnershipPolicy ownership) {
    this.comments = comments;
    this.reviews = reviews;
    this.users = users;
    this.ownership = ownership;
  }

  @Transactional
  public Long addComment(Long reviewId, AuthUser author, String text) {
    if (!StringUtils.hasText(text)) {
      throw new ValidationException("Comment text is required");
    }
    Review review = reviews.findById(reviewId).orElseThrow(() -> new NotFoundException("Review"));

    Comment c = new Comment();
    c.setReview(review);
    c.setUser(users.getReferenceById(author.id()));
    c.setCommentText(text);
    Long id = comments.save(c).getId();
    log.debug("User {} commented on review {}", author.id(), reviewId);
    return id;
  }

  /** Oldest first. An unknown review simply has no comments. */
  @Transactional(readOnly = true)
  public List<CommentRes> listComments(Long reviewId) {
    return comments.findForReviewWithAuthors(reviewId).stream()
        .map(CommentRes::from)
        .toList();
  }

  @Transactional
  public void deleteComment(Long commentId, AuthUser requester) {
    Comment c = comments.findById(commentId).orElseThrow(() -> new NotFoundException("Comment"));
    ownership.requireOwnerOrAdmin(c.getUser().getId(), requester, "You can only delete your own comments");
    comments.delete(c);
    log.info("User {} deleted comment {}", requester.id(), commentId);
  }
}
