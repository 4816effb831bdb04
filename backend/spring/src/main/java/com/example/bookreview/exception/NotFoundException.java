package com.example.bookreview.exception;

public class NotFoundException extends ApiException {
    public NotFoundException(String entity) {
        super(entity + " not found", "NOT_FOUND", 404);
    }
}
