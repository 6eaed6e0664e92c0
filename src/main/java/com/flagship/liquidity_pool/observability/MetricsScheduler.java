package com.flagship.liquidity_pool.observability;

import com.flagship.liquidity_pool.pool.PairStore;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically copies store sizes into the pool gauges.
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
public class MetricsScheduler {

    private final PoolMetrics poolMetrics;
    private final PairStore pairStore;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshStoreMetrics() {
        poolMetrics.updateStoreSize(pairStore.pairCount(), pairStore.assetCount());
    }
}
