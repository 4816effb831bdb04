package com.example.bookreview.api;

import com.example.bookreview.api.dto.ImageReq;
import com.example.bookreview.api.dto.ImageRes;
import com.example.bookreview.api.dto.SuccessResponse;
import com.example.bookreview.security.AuthUser;
import com.example.bookreview.service.ImageService;
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
public class ImageController {
  private final ImageService images;

  public ImageController(ImageService images) {
    this.images = images;
  }

  @PostMapping("/reviews/{reviewId}/images")
  public ResponseEntity<SuccessResponse<Map<String, Long>>> add(@PathVariable Long reviewId,
                                                                @AuthenticationPrincipal Jwt jwt,
                                                                @Valid @RequestBody ImageReq req) {
    Long id = images.addImage(reviewId, AuthUser.from(jwt), req);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(SuccessResponse.of("Image added successfully", Map.of("imageId", id)));
  }

  @GetMapping("/reviews/{reviewId}/images")
  public ResponseEntity<SuccessResponse<List<ImageRes>>> list(@PathVariable Long reviewId) {
    return ResponseEntity.ok(SuccessResponse.of("Images loaded", images.listImages(reviewId)));
  }

  @DeleteMapping("/images/{id}")
  public ResponseEntity<SuccessResponse<Void>> delete(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
    images.deleteImage(id, AuthUser.from(jwt));
    return ResponseEntity.ok(SuccessResponse.of("Image deleted successfully"));
  }
}
