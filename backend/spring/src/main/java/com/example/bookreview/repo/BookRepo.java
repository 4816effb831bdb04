package com.example.bookreview.repo;

import com.example.bookreview.domain.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface BookRepo extends JpaRepository<Book, Long> {
  List<Book> findAllByOrderByCreatedAtDescIdDesc();
  boolean existsByIsbn(String isbn);
  boolean existsByIsbnAndIdNot(String isbn, Long id);
}
