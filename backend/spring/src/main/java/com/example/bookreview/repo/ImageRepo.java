package com.example.bookreview.repo;

import com.example.bookreview.domain.Image;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface ImageRepo extends JpaRepository<Image, Long> {
  List<Image> findByReviewIdOrderByCreatedAtAscIdAsc(Long reviewId);
}
