package com.example.bookreview.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String code,
    int status,
    Instant timestamp,
    String path
) {
    public ErrorResponse(String error, String code, int status, String path) {
        this(error, code, status, Instant.now(), path);
    }
}
