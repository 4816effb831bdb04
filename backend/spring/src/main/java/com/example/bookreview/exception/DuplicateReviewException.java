package com.example.bookreview.exception;

public class DuplicateReviewException extends DuplicateException {
    public DuplicateReviewException() {
        super("You have already reviewed this book", "DUPLICATE_REVIEW");
    }
}
