package com.example.bookreview.exception;

public class DuplicateIsbnException extends DuplicateException {
    public DuplicateIsbnException(String isbn) {
        super("A book with ISBN " + isbn + " already exists", "DUPLICATE_ISBN");
    }
}
