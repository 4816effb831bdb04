package com.example.bookreview.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity @Table(name = "comments")
public class Comment {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "review_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private Review review;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "user_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private User user;

  @Column(nullable = false, columnDefinition = "text")
  private String commentText;

  @Column(nullable = false)
  private Instant createdAt = Instant.now();

  @Column(nullable = false)
  private Instant updatedAt = Instant.now();

  @PreUpdate
  void touch() { this.updatedAt = Instant.now(); }

  public Long getId(){ return id; }
  public void setId(Long id){ this.id = id; }
  public Review getReview(){ return review; }
  public void setReview(Review review){ this.review = review; }
  public User getUser(){ return user; }
  public void setUser(User user){ this.user = user; }
  public String getCommentText(){ return commentText; }
  public void setCommentText(String commentText){ this.commentText = commentText; }
  public Instant getCreatedAt(){ return createdAt; }
  public void setCreatedAt(Instant t){ this.createdAt = t; }
  public Instant getUpdatedAt(){ return updatedAt; }
}
