package com.flagship.liquidity_pool.event;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.pool.PairKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Default event sink: writes each pool event to the application log.
 */
@Component
@ConditionalOnProperty(name = "pool.events.kafka.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class LoggingEventSink implements EventSink {

    @Override
    public void assetRegistered(Asset asset) {
        log.info("AssetRegistered: asset={}", asset);
    }

    @Override
    public void pairCreated(Asset assetLow, Asset assetHigh) {
        log.info("PairCreated: assetLow={}, assetHigh={}", assetLow, assetHigh);
    }

    @Override
    public void swapExecuted(PairKey pair, String caller,
                             BigInteger amountLowIn, BigInteger amountHighIn,
                             BigInteger amountLowOut, BigInteger amountHighOut) {
        log.info("SwapExecuted: pair={}, caller={}, amountLowIn={}, amountHighIn={}, amountLowOut={}, amountHighOut={}",
                pair, caller, amountLowIn, amountHighIn, amountLowOut, amountHighOut);
    }
}
