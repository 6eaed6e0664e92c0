package com.flagship.liquidity_pool.config;

import com.flagship.liquidity_pool.ledger.InMemoryTokenLedger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory token ledger for local runs.
 *
 * Deployments that talk to real token adapters disable it with
 * pool.ledger.in-memory.enabled=false and provide their own TokenLedger bean.
 */
@Configuration
@ConditionalOnProperty(name = "pool.ledger.in-memory.enabled", havingValue = "true", matchIfMissing = true)
public class LedgerConfig {

    @Bean
    public InMemoryTokenLedger inMemoryTokenLedger(@Value("${pool.ledger.pool-account:pool}") String poolAccount) {
        return new InMemoryTokenLedger(poolAccount);
    }
}
