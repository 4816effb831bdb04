package com.example.bookreview.api;

import com.example.bookreview.api.dto.CommentReq;
import com.example.bookreview.api.dto.CommentRes;
import com.example.bookreview.api.dto.SuccessResponse;
import com.example.bookreview.security.AuthUser;
import com.example.bookreview.service.CommentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class CommentController {
  private final CommentService comments;

  public CommentController(CommentService comments) {
    this.comments = comments;
  }

  @PostMapping("/reviews/{reviewId}/comments")
  public ResponseEntity<SuccessResponse<Map<String, Long>>> add(@PathVariable Long reviewId,
                                                                @AuthenticationPrincipal Jwt jwt,
                                                                @Valid @RequestBody CommentReq req) {
    Long id = comments.addComment(reviewId, AuthUser.from(jwt), req.commentText());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(SuccessResponse.of("Comment added successfully", Map.of("commentId", id)));
  }

  @GetMapping("/reviews/{reviewId}/comments")
  public ResponseEntity<SuccessResponse<List<CommentRes>>> list(@PathVariable Long reviewId) {
    return ResponseEntity.ok(SuccessResponse.of("Comments loaded", comments.listComments(reviewId)));
  }

  @DeleteMapping("/comments/{id}")
  public ResponseEntity<SuccessResponse<Void>> delete(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
    comments.deleteComment(id, AuthUser.from(jwt));
    return ResponseEntity.ok(SuccessResponse.of("Comment deleted successfully"));
  }
}
