package com.flagship.liquidity_pool.pool.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 *
 * error holds the machine-readable code (e.g. PAIR_NOT_FOUND), message the
 * human-readable explanation.
 */
@Value
@Builder
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
