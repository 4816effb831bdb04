package com.example.bookreview.exception;

/** A uniqueness rule caught by the pre-insert existence check. */
public class DuplicateException extends ApiException {
    public DuplicateException(String message, String errorCode) {
        super(message, errorCode, 400);
    }
}
