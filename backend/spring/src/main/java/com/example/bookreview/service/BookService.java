package com.example.bookreview.service;

import com.example.bookreview.api.dto.BookReq;
import com.example.bookreview.api.dto.BookRes;
import com.example.bookreview.domain.Book;
import com.example.bookreview.exception.DuplicateIsbnException;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.repo.BookRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Catalog management. Role gating happens on the controller; this class assumes an admin caller
 * for every mutating method.
 */
@Slf4j
@Service
public class BookService {
  private final BookRepo books;

  public BookService(BookRepo books) {
    this.books = books;
  }

  @Transactional(readOnly = true)
  public List<BookRes> listBooks() {
    return books.findAllByOrderByCreatedAtDescIdDesc().stream()
        .map(BookRes::from)
        .toList();
  }

  @Transactional
  public Long createBook(BookReq req) {
    String isbn = normalizeIsbn(req.isbn());
    if (isbn != null && books.existsByIsbn(isbn)) {
      throw new DuplicateIsbnException(isbn);
    }
    Book b = new Book();
    apply(b, req, isbn);
    Long id = books.save(b).getId();
    log.info("Created book {} '{}'", id, b.getTitle());
    return id;
  }

  /** Full replacement of the book's fields. */
  @Transactional
  public void updateBook(Long id, BookReq req) {
    Book b = books.findById(id).orElseThrow(() -> new NotFoundException("Book"));
    String isbn = normalizeIsbn(req.isbn());
    if (isbn != null && books.existsByIsbnAndIdNot(isbn, id)) {
      throw new DuplicateIsbnException(isbn);
    }
    apply(b, req, isbn);
    books.save(b);
    log.info("Updated book {}", id);
  }

  /** Reviews, and through them comments and images, go with the book via foreign-key cascades. */
  @Transactional
  public void deleteBook(Long id) {
    Book b = books.findById(id).orElseThrow(() -> new NotFoundException("Book"));
    books.delete(b);
    log.info("Deleted book {} '{}'", id, b.getTitle());
  }

  private static void apply(Book b, BookReq req, String isbn) {
    b.setTitle(req.title().trim());
    b.setAuthor(req.author().trim());
    b.setIsbn(isbn);
    b.setDescription(req.description());
    b.setPublishedYear(req.publishedYear());
    b.setGenre(req.genre());
    b.setCoverImage(req.coverImage());
  }

  static String normalizeIsbn(String isbn) {
    return StringUtils.hasText(isbn) ? isbn.trim() : null;
  }
}
