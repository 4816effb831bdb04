package com.example.bookreview.api.dto;

public record TokenRes(String token, UserRes user) {}
