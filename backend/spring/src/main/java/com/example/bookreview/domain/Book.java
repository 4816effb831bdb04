package com.example.bookreview.domain;

import jakarta.persistence.*;
import java.time.Instant;

@Entity @Table(name = "books")
public class Book {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String title;

  @Column(nullable = false)
  private String author;

  @Column(unique = true, length = 20)
  private String isbn;

  @Column(columnDefinition = "text")
  private String description;

  @Column(length = 500)
  private String coverImage;

  private Integer publishedYear;

  @Column(length = 100)
  private String genre;

  @Column(nullable = false)
  private Instant createdAt = Instant.now();

  @Column(nullable = false)
  private Instant updatedAt = Instant.now();

  @PreUpdate
  void touch() { this.updatedAt = Instant.now(); }

  public Long getId(){ return id; }
  public void setId(Long id){ this.id = id; }
  public String getTitle(){ return title; }
  public void setTitle(String title){ this.title = title; }
  public String getAuthor(){ return author; }
  public void setAuthor(String author){ this.author = author; }
  public String getIsbn(){ return isbn; }
  public void setIsbn(String isbn){ this.isbn = isbn; }
  public String getDescription(){ return description; }
  public void setDescription(String description){ this.description = description; }
  public String getCoverImage(){ return coverImage; }
  public void setCoverImage(String coverImage){ this.coverImage = coverImage; }
  public Integer getPublishedYear(){ return publishedYear; }
  public void setPublishedYear(Integer publishedYear){ this.publishedYear = publishedYear; }
  public String getGenre(){ return genre; }
  public void setGenre(String genre){ this.genre = genre; }
  public Instant getCreatedAt(){ return createdAt; }
  public void setCreatedAt(Instant t){ this.createdAt = t; }
  public Instant getUpdatedAt(){ return updatedAt; }
}
