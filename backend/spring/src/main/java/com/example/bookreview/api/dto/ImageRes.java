package com.example.bookreview.api.dto;

import com.example.bookreview.domain.Image;
import java.time.Instant;

public record ImageRes(Long id, Long reviewId, String imageUrl, String imageName, Instant createdAt) {
  public static ImageRes from(Image i) {
    return new ImageRes(i.getId(), i.getReview().getId(), i.getImageUrl(), i.getImageName(), i.getCreatedAt());
  }
}
