package com.example.bookreview.api.dto;

import java.util.List;

public record BookDetailRes(
  BookRes book,
  List<ReviewRes> reviews,
  double averageRating,
  int totalReviews
) {}
