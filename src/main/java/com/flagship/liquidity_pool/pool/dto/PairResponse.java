package com.flagship.liquidity_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.liquidity_pool.pool.Pair;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Response DTO for a pair, reserves in canonical order.
 */
@Value
@Builder
public class PairResponse {

    @JsonProperty("asset_low")
    String assetLow;

    @JsonProperty("asset_high")
    String assetHigh;

    @JsonProperty("reserve_low")
    BigInteger reserveLow;

    @JsonProperty("reserve_high")
    BigInteger reserveHigh;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PairResponse from(Pair pair) {
        return PairResponse.builder()
            .assetLow(pair.getAssetLow().getId())
            .assetHigh(pair.getAssetHigh().getId())
            .reserveLow(pair.getReserveLow())
            .reserveHigh(pair.getReserveHigh())
            .createdAt(pair.getCreatedAt())
            .updatedAt(pair.getUpdatedAt())
            .build();
    }
}
