package com.example.bookreview.service;

import com.example.bookreview.api.dto.BookDetailRes;
import com.example.bookreview.api.dto.BookRes;
import com.example.bookreview.api.dto.ImageRes;
import com.example.bookreview.api.dto.ReviewRes;
import com.example.bookreview.domain.Book;
import com.example.bookreview.domain.Review;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.repo.BookRepo;
import com.example.bookreview.repo.CommentRepo;
import com.example.bookreview.repo.ImageRepo;
import com.example.bookreview.repo.ReviewRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the book detail view. Average rating and review count are computed on every read
 * from the reviews fetched for that response.
 */
@Service
public class ReviewAggregationService {
  private final BookRepo books;
  private final ReviewRepo reviews;
  private final CommentRepo comments;
  private final ImageRepo images;

  public ReviewAggregationService(BookRepo books, ReviewRepo reviews, CommentRepo comments, ImageRepo images) {
    this.books = books;
    this.reviews = reviews;
    this.comments = comments;
    this.images = images;
  }

  @Transactional(readOnly = true)
  public BookDetailRes getBookDetail(Long bookId) {
    Book book = books.findById(bookId).orElseThrow(() -> new NotFoundException("Book"));

    List<Review> found = reviews.findForBookWithAuthors(bookId);
    List<ReviewRes> rows = new ArrayList<>(found.size());
    for (Review r : found) {
      List<ImageRes> attached = images.findByReviewIdOrderByCreatedAtAscIdAsc(r.getId()).stream()
          .map(ImageRes::from)
          .toList();
      rows.add(ReviewRes.from(r, comments.countByReviewId(r.getId()), attached));
    }

    return new BookDetailRes(BookRes.from(book), rows, averageRating(found), found.size());
  }

  /** Mean rating, 0 for an empty list. */
  static double averageRating(List<Review> reviews) {
    return reviews.stream()
        .mapToInt(Review::getRating)
        .average()
        .orElse(0);
  }
}
