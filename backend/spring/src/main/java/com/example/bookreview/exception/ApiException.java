package com.example.bookreview.exception;

/**
 * Base type for every failure that maps to a client-visible error body.
 * Subclasses fix the error code and HTTP status.
 */
public abstract class ApiException extends RuntimeException {
    private final String errorCode;
    private final int statusCode;

    protected ApiException(String message, String errorCode, int statusCode) {
        super(message);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
