package com.example.bookreview.util;

import com.example.bookreview.exception.WeakPasswordException;

public class PasswordValidator {

    static final int MIN_LENGTH = 6;
    static final int MAX_LENGTH = 128;

    private PasswordValidator() {}

    public static void validate(String password) {
        if (password == null || password.trim().isEmpty()) {
            throw new WeakPasswordException("password is required");
        }

        if (password.length() < MIN_LENGTH) {
            throw new WeakPasswordException("must be at least " + MIN_LENGTH + " characters");
        }

        if (password.length() > MAX_LENGTH) {
            throw new WeakPasswordException("must be at most " + MAX_LENGTH + " characters");
        }
    }
}
