package com.example.bookreview.service;

import com.example.bookreview.api.dto.ReviewReq;
import com.example.bookreview.domain.Book;
import com.example.bookreview.domain.Review;
import com.example.bookreview.exception.DuplicateReviewException;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.exception.ValidationException;
import com.example.bookreview.repo.BookRepo;
import com.example.bookreview.repo.ReviewRepo;
import com.example.bookreview.repo.UserRepo;
import com.example.bookreview.security.AuthUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
public class ReviewService {
  static final int MIN_RATING = 1;
  static final int MAX_RATING = 5;

  private final ReviewRepo reviews;
  private final BookRepo books;
  private final UserRepo users;
  private final OwnershipPolicy ownership;

  public ReviewService(ReviewRepo reviews, BookRepo books, UserRepo users, OwnershipPolicy ownership) {
    this.reviews = reviews;
    this.books = books;
    this.users = users;
    this.ownership = ownership;
  }

  /**
   * One review per user and book. The existence check runs before the insert; the unique key on
   * (user_id, book_id) is the backstop for concurrent writers.
   */
  @Transactional
  public Long createReview(Long bookId, AuthUser author, ReviewReq req) {
    int rating = requireRating(req.rating());
    Book book = books.findById(bookId).orElseThrow(() -> new NotFoundException("Book"));
    if (reviews.existsByBookIdAndUserId(bookId, author.id())) {
      throw new DuplicateReviewException();
    }

    Review r = new Review();
    r.setBook(book);
    r.setUser(users.getReferenceById(author.id()));
    r.setRating(rating);
    r.setReviewText(req.reviewText());
    Long id = reviews.save(r).getId();
    log.info("User {} reviewed book {} with {} stars", author.id(), bookId, rating);
    return id;
  }

  @Transactional
  public void updateReview(Long reviewId, AuthUser requester, ReviewReq req) {
    int rating = requireRating(req.rating());
    Review r = findReview(reviewId);
    ownership.requireOwnerOrAdmin(r.getUser().getId(), requester, "You can only edit your own reviews");
    r.setRating(rating);
    r.setReviewText(req.reviewText());
    reviews.save(r);
  }

  /** Comments and images of the review are removed by the database cascade. */
  @Transactional
  public void deleteReview(Long reviewId, AuthUser requester) {
    Review r = findReview(reviewId);
    ownership.requireOwnerOrAdmin(r.getUser().getId(), requester, "You can only delete your own reviews");
    reviews.delete(r);
    log.info("User {} deleted review {}", requester.id(), reviewId);
  }

  @Transactional(readOnly = true)
  public long countReviews() {
    return reviews.count();
  }

  Review findReview(Long reviewId) {
    return reviews.findById(reviewId).orElseThrow(() -> new NotFoundException("Review"));
  }

  static int requireRating(Number rating) {
    if (rating == null || !isWhole(rating) || rating.intValue() < MIN_RATING || rating.intValue() > MAX_RATING) {
      throw new ValidationException("Rating must be between " + MIN_RATING + " and " + MAX_RATING);
    }
    return rating.intValue();
  }

  private static boolean isWhole(Number n) {
    double v = n.doubleValue();
    return v == Math.rint(v);
  }
}
