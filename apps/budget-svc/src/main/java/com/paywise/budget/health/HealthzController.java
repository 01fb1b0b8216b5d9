package com.paywise.budget.health;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public health endpoint. The service cannot analyze anything without its store, so the
 * check includes a database round trip and reports 503 when that fails.
 */
@RestController
public class HealthzController {

    private static final Logger log = LoggerFactory.getLogger(HealthzController.class);
    static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;

    public HealthzController(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> healthz() {
        if (databaseReachable()) {
            return ResponseEntity.ok(Map.of("status", "UP", "database", "UP"));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", "DOWN", "database", "DOWN"));
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException ex) {
            log.warn("Health check could not reach the database: {}", ex.getMessage());
            return false;
        }
    }
}
