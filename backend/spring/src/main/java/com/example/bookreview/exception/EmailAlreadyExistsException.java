package com.example.bookreview.exception;

public class EmailAlreadyExistsException extends DuplicateException {
    public static final String ON_REGISTER = "User already exists";
    public static final String ON_PROFILE_UPDATE = "Email already taken";

    public EmailAlreadyExistsException(String message) {
        super(message, "DUPLICATE_EMAIL");
    }
}
