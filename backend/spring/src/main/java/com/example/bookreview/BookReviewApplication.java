package com.example.bookreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookReviewApplication {
  public static void main(String[] args) {
    SpringApplication.run(BookReviewApplication.class, args);
  }
}
