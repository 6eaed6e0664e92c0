package com.flagship.liquidity_pool.pool.exception;

/**
 * Raised when a pool operation is rejected.
 * The {@link PoolError} code identifies the rule that was violated.
 */
public class PoolException extends RuntimeException {

    private final PoolError error;

    public PoolException(PoolError error, String message) {
        super(message);
        this.error = error;
    }

    public PoolException(PoolError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public PoolError getError() {
        return error;
    }

    public static PoolException of(PoolError error, String format, Object... args) {
        return new PoolException(error, String.format(format, args));
    }
}
