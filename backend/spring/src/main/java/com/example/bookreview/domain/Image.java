package com.example.bookreview.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/** Picture attached to a review. It has no owner column; the review's author owns it. */
@Entity @Table(name = "images")
public class Image {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "review_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private Review review;

  @Column(nullable = false, length = 500)
  private String imageUrl;

  private String imageName;

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
  public String getImageUrl(){ return imageUrl; }
  public void setImageUrl(String imageUrl){ this.imageUrl = imageUrl; }
  public String getImageName(){ return imageName; }
  public void setImageName(String imageName){ this.imageName = imageName; }
  public Instant getCreatedAt(){ return createdAt; }
  public void setCreatedAt(Instant t){ this.createdAt = t; }
  public Instant getUpdatedAt(){ return updatedAt; }
}
