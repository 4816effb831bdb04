package com.example.bookreview.api;

import com.example.bookreview.api.dto.BookDetailRes;
import com.example.bookreview.api.dto.BookReq;
import com.example.bookreview.api.dto.BookRes;
import com.example.bookreview.api.dto.SuccessResponse;
import com.example.bookreview.security.AdminOnly;
import com.example.bookreview.service.BookService;
import com.example.bookreview.service.ReviewAggregationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/books")
public class BookController {
  private final BookService books;
  private final ReviewAggregationService details;

  public BookController(BookService books, ReviewAggregationService details) {
    this.books = books;
    this.details = details;
  }

  @GetMapping
  public ResponseEntity<SuccessResponse<List<BookRes>>> list() {
    return ResponseEntity.ok(SuccessResponse.of("Books loaded", books.listBooks()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<SuccessResponse<BookDetailRes>> detail(@PathVariable Long id) {
    return ResponseEntity.ok(SuccessResponse.of("Book loaded", details.getBookDetail(id)));
  }

  @AdminOnly
  @PostMapping
  public ResponseEntity<SuccessResponse<Map<String, Long>>> create(@Valid @RequestBody BookReq req) {
    Long id = books.createBook(req);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(SuccessResponse.of("Book created successfully", Map.of("bookId", id)));
  }

  @AdminOnly
  @PutMapping("/{id}")
  public ResponseEntity<SuccessResponse<Void>> update(@PathVariable Long id, @Valid @RequestBody BookReq req) {
    books.updateBook(id, req);
    return ResponseEntity.ok(SuccessResponse.of("Book updated successfully"));
  }

  @AdminOnly
  @DeleteMapping("/{id}")
  public ResponseEntity<SuccessResponse<Void>> delete(@PathVariable Long id) {
    books.deleteBook(id);
    return ResponseEntity.ok(SuccessResponse.of("Book deleted successfully"));
  }
}
