package com.flagship.liquidity_pool.health;

import com.flagship.liquidity_pool.pool.PairStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final PairStore pairStore;

    public HealthController(PairStore pairStore) {
        this.pairStore = pairStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("pairs", pairStore.pairCount());
        response.put("assets", pairStore.assetCount());
        return ResponseEntity.ok(response);
    }
}
