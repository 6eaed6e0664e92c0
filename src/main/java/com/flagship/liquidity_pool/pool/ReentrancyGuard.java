package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion for state-changing pool calls.
 *
 * A second entry from the thread that already holds the guard is a callback
 * re-entering the engine mid-call; it fails at once instead of nesting.
 * Other threads wait their turn.
 *
 * Usage:
 * <pre>
 * guard.enter();
 * try {
 *     ...
 * } finally {
 *     guard.exit();
 * }
 * </pre>
 */
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @throws PoolException REENTRANCY_VIOLATION if the current thread is already inside
     */
    public void enter() {
        if (lock.isHeldByCurrentThread()) {
            throw new PoolException(PoolError.REENTRANCY_VIOLATION,
                    "Pool call re-entered while another call on this thread is in flight");
        }
        lock.lock();
    }

    public void exit() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
