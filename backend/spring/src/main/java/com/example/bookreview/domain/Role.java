package com.example.bookreview.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
  USER("user"),
  ADMIN("admin");

  private final String value;

  Role(String value) { this.value = value; }

  /** Lower-case form used in token claims and JSON payloads. */
  @JsonValue
  public String value() { return value; }

  public static Role fromValue(String value) {
    for (Role r : values()) {
      if (r.value.equalsIgnoreCase(value)) return r;
    }
    throw new IllegalArgumentException("Unknown role: " + value);
  }
}
