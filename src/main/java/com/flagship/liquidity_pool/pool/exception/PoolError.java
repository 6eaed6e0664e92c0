package com.flagship.liquidity_pool.pool.exception;

/**
 * Failure codes raised by the pool engine.
 *
 * Every code aborts the call with no state change.
 */
public enum PoolError {
    DUPLICATE_ASSET(Category.VALIDATION),
    INVALID_ASSET(Category.VALIDATION),
    IDENTICAL_ASSETS(Category.VALIDATION),
    ASSET_NOT_REGISTERED(Category.VALIDATION),
    PAIR_ALREADY_EXISTS(Category.VALIDATION),
    PAIR_NOT_FOUND(Category.VALIDATION),
    INSUFFICIENT_LIQUIDITY(Category.VALIDATION),
    INVALID_ASSET_PAIR(Category.VALIDATION),
    INSUFFICIENT_INPUT(Category.VALIDATION),
    INSUFFICIENT_OUTPUT(Category.VALIDATION),

    /**
     * The caller is the pool's own reserve account.
     */
    INVALID_CALLER(Category.VALIDATION),

    /**
     * A callback tried to enter the engine while a call was still in flight.
     */
    REENTRANCY_VIOLATION(Category.CONCURRENCY),

    /**
     * The computed post-swap reserves would shrink the invariant product.
     * Never expected from a correct quote.
     */
    INVARIANT_VIOLATION(Category.INTERNAL);

    public enum Category {
        VALIDATION,
        CONCURRENCY,
        INTERNAL
    }

    private final Category category;

    PoolError(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
