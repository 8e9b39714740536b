package com.payment.checkout.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint with a database check. Answers 503 when the database is unreachable.
 */
@Slf4j
@RestController
public class HealthController {

    private final DataSource dataSource;

    public HealthController(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean dbHealthy = checkDatabase();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", dbHealthy);
        body.put("status", dbHealthy ? "UP" : "DOWN");
        body.put("database", dbHealthy ? "UP" : "DOWN");
        return ResponseEntity.status(dbHealthy ? 200 : 503)
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(body);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Health check database query failed: {}", e.getMessage());
            return false;
        }
    }
}
