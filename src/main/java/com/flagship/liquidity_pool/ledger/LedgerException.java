package com.flagship.liquidity_pool.ledger;

/**
 * Failure reported by a {@link TokenLedger}.
 * The pool engine propagates it to its caller unchanged.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }
}
