package com.example.bookreview.repo;

import com.example.bookreview.domain.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.List;

public interface CommentRepo extends JpaRepository<Comment, Long> {

  @Query("select c from Comment c join fetch c.user where c.review.id = :reviewId order by c.createdAt asc, c.id asc")
  List<Comment> findForReviewWithAuthors(@Param("reviewId") Long reviewId);

  long countByReviewId(Long reviewId);
}
