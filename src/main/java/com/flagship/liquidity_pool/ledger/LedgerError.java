package com.flagship.liquidity_pool.ledger;

/**
 * Reasons a token ledger refuses a request.
 */
public enum LedgerError {
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_ALLOWANCE,
    UNKNOWN_ASSET
}
