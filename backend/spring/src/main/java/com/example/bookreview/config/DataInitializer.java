package com.example.bookreview.config;

import com.example.bookreview.domain.Book;
import com.example.bookreview.domain.Role;
import com.example.bookreview.domain.User;
import com.example.bookreview.repo.BookRepo;
import com.example.bookreview.repo.UserRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Seeds the admin account and, on an empty catalog, a few sample books.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer implements ApplicationRunner {
  private final UserRepo users;
  private final BookRepo books;
  private final PasswordEncoder encoder;

  @Value("${app.seed.admin-email}") String adminEmail;
  @Value("${app.seed.admin-password}") String adminPassword;
  @Value("${app.seed.admin-name:Admin User}") String adminName;
  @Value("${app.seed.sample-books:true}") boolean sampleBooks;

  public DataInitializer(UserRepo users, BookRepo books, PasswordEncoder encoder) {
    this.users = users;
    this.books = books;
    this.encoder = encoder;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    seedAdmin();
    if (sampleBooks) {
      seedBooks();
    }
  }

  void seedAdmin() {
    String email = adminEmail.trim().toLowerCase(Locale.ROOT);
    if (users.existsByEmailIgnoreCase(email)) {
      return;
    }
    User admin = new User();
    admin.setName(adminName);
    admin.setEmail(email);
    admin.setPasswordHash(encoder.encode(adminPassword));
    admin.setRole(Role.ADMIN);
    users.save(admin);
    log.info("Admin user {} created", email);
  }

  void seedBooks() {
    if (books.count() > 0) {
      return;
    }
    List<Book> samples = List.of(
        book("The Great Gatsby", "F. Scott Fitzgerald", "978-0743273565", 1925, "Classic Fiction",
            "A story of the fabulously wealthy Jay Gatsby and his love for the beautiful Daisy Buchanan.",
            "https://images.unsplash.com/photo-1544947950-fa07a98d237f?w=300&h=400&fit=crop"),
        book("To Kill a Mockingbird", "Harper Lee", "978-0446310789", 1960, "Classic Fiction",
            "The story of young Scout Finch and her father Atticus in a racially divided Alabama town.",
            "https://images.unsplash.com/photo-1512820790803-83ca734da794?w=300&h=400&fit=crop"),
        book("1984", "George Orwell", "978-0451524935", 1949, "Science Fiction",
            "A dystopian novel about totalitarianism and surveillance society.",
            "https://images.unsplash.com/photo-1541963463532-d68292c34b19?w=300&h=400&fit=crop"));
    books.saveAll(samples);
    log.info("Added {} sample books", samples.size());
  }

  private static Book book(String title, String author, String isbn, int year, String genre,
                           String description, String cover) {
    Book b = new Book();
    b.setTitle(title);
    b.setAuthor(author);
    b.setIsbn(isbn);
    b.setPublishedYear(year);
    b.setGenre(genre);
    b.setDescription(description);
    b.setCoverImage(cover);
    return b;
  }
}
