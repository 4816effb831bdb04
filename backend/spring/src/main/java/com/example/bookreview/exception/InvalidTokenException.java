package com.example.bookreview.exception;

public class InvalidTokenException extends ApiException {
    public InvalidTokenException() {
        super("Invalid token", "INVALID_TOKEN", 401);
    }
}
