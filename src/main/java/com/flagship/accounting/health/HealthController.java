package com.flagship.accounting.health;

import com.flagship.accounting.period.FinancialPeriodService;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint outside the Actuator tree.
 * Reports whether postings dated today have an OPEN period to land in.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final FinancialPeriodService periodService;

    public HealthController(DataSource dataSource, FinancialPeriodService periodService) {
        this.dataSource = dataSource;
        this.periodService = periodService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("openPeriodToday", periodService.hasOpenPeriod(LocalDate.now()));
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
