package com.example.bookreview.api;

import com.example.bookreview.api.dto.ReviewReq;
import com.example.bookreview.api.dto.SuccessResponse;
import com.example.bookreview.security.AdminOnly;
import com.example.bookreview.security.AuthUser;
import com.example.bookreview.service.ReviewService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class ReviewController {
  private final ReviewService reviews;

  public ReviewController(ReviewService reviews) {
    this.reviews = reviews;
  }

  @PostMapping("/books/{bookId}/reviews")
  public ResponseEntity<SuccessResponse<Map<String, Long>>> create(@PathVariable Long bookId,
                                                                   @AuthenticationPrincipal Jwt jwt,
                                                                   @RequestBody ReviewReq req) {
    Long id = reviews.createReview(bookId, AuthUser.from(jwt), req);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(SuccessResponse.of("Review created successfully", Map.of("reviewId", id)));
  }

  @PutMapping("/reviews/{id}")
  public ResponseEntity<SuccessResponse<Void>> update(@PathVariable Long id,
                                                      @AuthenticationPrincipal Jwt jwt,
                                                      @RequestBody ReviewReq req) {
    reviews.updateReview(id, AuthUser.from(jwt), req);
    return ResponseEntity.ok(SuccessResponse.of("Review updated successfully"));
  }

  @DeleteMapping("/reviews/{id}")
  public ResponseEntity<SuccessResponse<Void>> delete(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
    reviews.deleteReview(id, AuthUser.from(jwt));
    return ResponseEntity.ok(SuccessResponse.of("Review deleted successfully"));
  }

  @AdminOnly
  @GetMapping("/reviews/count")
  public ResponseEntity<SuccessResponse<Map<String, Long>>> count() {
    return ResponseEntity.ok(SuccessResponse.of("Review count loaded", Map.of("totalReviews", reviews.countReviews())));
  }
}
