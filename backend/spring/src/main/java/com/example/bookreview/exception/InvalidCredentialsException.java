package com.example.bookreview.exception;

public class InvalidCredentialsException extends ApiException {
    public InvalidCredentialsException() {
        super("Invalid credentials", "INVALID_CREDENTIALS", 401);
    }
}
