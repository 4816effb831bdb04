package com.example.bookreview.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * A star rating left by one user on one book. The (user, book) pair is unique, and the
 * row goes away with its book or its author through database-level cascades.
 */
@Entity @Table(name = "reviews",
    uniqueConstraints = @UniqueConstraint(name = "unique_user_book", columnNames = {"user_id", "book_id"}))
public class Review {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "book_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private Book book;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "user_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private User user;

  @Column(nullable = false)
  private int rating;

  @Column(columnDefinition = "text")
  private String reviewText;

  @Column(nullable = false)
  private Instant createdAt = Instant.now();

  @Column(nullable = false)
  private Instant updatedAt = Instant.now();

  @PreUpdate
  void touch() { this.updatedAt = Instant.now(); }

  public Long getId(){ return id; }
  public void setId(Long id){ this.id = id; }
  public Book getBook(){ return book; }
  public void setBook(Book book){ this.book = book; }
  public User getUser(){ return user; }
  public void setUser(User user){ this.user = user; }
  public int getRating(){ return rating; }
  public void setRating(int rating){ this.rating = rating; }
  public String getReviewText(){ return reviewText; }
  public void setReviewText(String reviewText){ this.reviewText = reviewText; }
  public Instant getCreatedAt(){ return createdAt; }
  public void setCreatedAt(Instant t){ this.createdAt = t; }
  public Instant getUpdatedAt(){ return updatedAt; }
}
