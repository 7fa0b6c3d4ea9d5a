package com.volunteersinc.payment_settlement.health;

import com.volunteersinc.payment_settlement.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness check that does not need actuator access.
 * Reports the outbox backlog alongside database reachability.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxService outboxService;
    private final Clock clock;

    public HealthController(DataSource dataSource, OutboxService outboxService, Clock clock) {
        this.dataSource = dataSource;
        this.outboxService = outboxService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now(clock).toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("outboxBacklog", outboxService.countUnpublished());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
