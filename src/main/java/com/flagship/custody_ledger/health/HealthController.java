package com.flagship.custody_ledger.health;

import com.flagship.custody_ledger.outbox.OutboxService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness check that needs no authorization, unlike the actuator one.
 */
@RestController
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
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("outboxBacklog", outboxService.countUnpublished());
        response.put("outboxDeadLettered", outboxService.countDeadLettered());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
