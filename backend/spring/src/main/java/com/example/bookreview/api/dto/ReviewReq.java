package com.example.bookreview.api.dto;

/** Rating stays an untyped number so a fractional value reaches the review service unrounded. */
public record ReviewReq(Number rating, String reviewText) {}
