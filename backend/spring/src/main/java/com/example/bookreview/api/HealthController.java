package com.example.bookreview.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;

@Slf4j
@RestController
public class HealthController {
  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  private final DataSource dataSource;

  public HealthController(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    return Map.of(
        "status", "OK",
        "timestamp", Instant.now().toString(),
        "database", databaseState());
  }

  private String databaseState() {
    try (Connection c = dataSource.getConnection()) {
      return c.isValid(VALIDATION_TIMEOUT_SECONDS) ? "connected" : "disconnected";
    } catch (SQLException e) {
      log.warn("Health check could not reach the database: {}", e.getMessage());
      return "disconnected";
    }
  }
}
