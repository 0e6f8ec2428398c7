package com.examify.api.controller;

import com.examify.core.index.VectorIndexClient;
import com.examify.llm.service.EmbeddingService;
import com.examify.llm.service.LlmService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness, reachable without a user id.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final LlmService llmService;
    private final EmbeddingService embeddingService;
    private final VectorIndexClient vectorIndexClient;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "examify");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("service", "examify");
        response.put("generationProvider", llmService.getProviderName() + "/" + llmService.getModel());
        response.put("embeddingProvider", embeddingService.getProviderName());
        response.put("embeddingDimension", embeddingService.getDimension());
        response.put("indexDimension", vectorIndexClient.getDimension());

        boolean databaseUp;
        try (Connection connection = dataSource.getConnection()) {
            databaseUp = connection.isValid(2);
        } catch (Exception e) {
            log.warn("[HEALTH] Database check failed | error={}", e.getMessage());
            databaseUp = false;
        }
        response.put("database", databaseUp ? "UP" : "DOWN");
        response.put("status", databaseUp ? "UP" : "DEGRADED");

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}
