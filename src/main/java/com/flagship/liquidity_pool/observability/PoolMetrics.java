package com.flagship.liquidity_pool.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for pool operations.
 *
 * Metrics exposed:
 * - pool.swaps: Counter of swap attempts, tagged by result
 * - pool.pairs.created: Counter of created pairs
 * - pool.assets.registered: Counter of registered assets
 * - pool.errors: Counter of rejected calls, tagged by error code
 * - pool.swap.duration: Timer for swap calls
 * - pool.pairs.count / pool.assets.count: Gauges refreshed by {@link MetricsScheduler}
 * - pool.events.published / pool.events.publish.failure: Event sink delivery
 */
@Component
public class PoolMetrics {

    private final MeterRegistry registry;

    private final Counter pairsCreated;
    private final Counter assetsRegistered;
    private final Timer swapTimer;

    // Cached values updated periodically
    private final AtomicLong pairCount = new AtomicLong(0);
    private final AtomicLong assetCount = new AtomicLong(0);

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.pairsCreated = Counter.builder("pool.pairs.created")
                .description("Number of pairs created")
                .register(registry);

        this.assetsRegistered = Counter.builder("pool.assets.registered")
                .description("Number of assets registered")
                .register(registry);

        this.swapTimer = Timer.builder("pool.swap.duration")
                .description("Time taken to execute a swap")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("pool.pairs.count", pairCount, AtomicLong::get)
                .description("Number of pairs in the store")
                .register(registry);

        Gauge.builder("pool.assets.count", assetCount, AtomicLong::get)
                .description("Number of registered assets")
                .register(registry);
    }

    // ==================== Counter Methods ====================

    public void incrementPairsCreated() {
        pairsCreated.increment();
    }

    public void incrementAssetsRegistered() {
        assetsRegistered.increment();
    }

    public void recordSwap(String result) {
        registry.counter("pool.swaps", "result", sanitizeTag(result)).increment();
    }

    /**
     * Records a rejected call with its error code.
     */
    public void recordError(String operation, String code) {
        registry.counter("pool.errors",
                "operation", sanitizeTag(operation),
                "code", sanitizeTag(code)
        ).increment();
    }

    public void recordEventPublished(String eventType) {
        registry.counter("pool.events.published", "event_type", sanitizeTag(eventType)).increment();
    }

    public void recordEventPublishFailure(String eventType) {
        registry.counter("pool.events.publish.failure", "event_type", sanitizeTag(eventType)).increment();
    }

    // ==================== Timer Methods ====================

    public void recordSwapDuration(Duration duration) {
        swapTimer.record(duration);
    }

    // ==================== Gauge Methods ====================

    public void updateStoreSize(long pairs, long assets) {
        pairCount.set(pairs);
        assetCount.set(assets);
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
