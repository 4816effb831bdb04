package com.example.bookreview.exception;

public class WeakPasswordException extends ApiException {
    public WeakPasswordException(String reason) {
        super("Password is too weak: " + reason, "WEAK_PASSWORD", 400);
    }
}
