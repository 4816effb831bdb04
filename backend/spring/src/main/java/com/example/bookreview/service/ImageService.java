package com.example.bookreview.service;

import com.example.bookreview.api.dto.ImageReq;
import com.example.bookreview.api.dto.ImageRes;
import com.example.bookreview.domain.Image;
import com.example.bookreview.domain.Review;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.repo.ImageRepo;
import com.example.bookreview.repo.ReviewRepo;
import com.example.bookreview.security.AuthUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Review images. An image is owned by whoever wrote its review.
 */
@Slf4j
@Service
public class ImageService {
  private final ImageRepo images;
  private final ReviewRepo reviews;
  private final OwnershipPolicy ownership;

  public ImageService(ImageRepo images, ReviewRepo reviews, OwnershipPolicy ownership) {
    this.images = images;
    this.reviews = reviews;
    this.ownership = ownership;
  }

  @Transactional
  public Long addImage(Long reviewId, AuthUser requester, ImageReq req) {
    Review review = reviews.findById(reviewId).orElseThrow(() -> new NotFoundException("Review"));
    ownership.requireOwnerOrAdmin(review.getUser().getId(), requester, "You can only add images to your own reviews");

    Image i = new Image();
    i.setReview(review);
    i.setImageUrl(req.imageUrl().trim());
    i.setImageName(req.imageName());
    Long id = images.save(i).getId();
    log.info("User {} attached image {} to review {}", requester.id(), id, reviewId);
    return id;
  }

  @Transactional(readOnly = true)
  public List<ImageRes> listImages(Long reviewId) {
    return images.findByReviewIdOrderByCreatedAtAscIdAsc(reviewId).stream()
        .map(ImageRes::from)
        .toList();
  }

  @Transactional
  public void deleteImage(Long imageId, AuthUser requester) {
    Image i = images.findById(imageId).orElseThrow(() -> new NotFoundException("Image"));
    Long ownerId = i.getReview().getUser().getId();
    ownership.requireOwnerOrAdmin(ownerId, requester, "You can only delete images from your own reviews");
    images.delete(i);
    log.info("User {} deleted image {}", requester.id(), imageId);
  }
}
