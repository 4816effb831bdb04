package com.example.bookreview.repo;

import com.example.bookreview.domain.Review;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.List;

public interface ReviewRepo extends JpaRepository<Review, Long> {

  /** Reviews of a book, newest first, with their authors loaded in the same round trip. */
  @Query("select r from Review r join fetch r.user where r.book.id = :bookId order by r.createdAt desc, r.id desc")
  List<Review> findForBookWithAuthors(@Param("bookId") Long bookId);

  boolean existsByBookIdAndUserId(Long bookId, Long userId);
}
