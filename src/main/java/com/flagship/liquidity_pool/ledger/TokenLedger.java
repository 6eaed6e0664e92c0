package com.flagship.liquidity_pool.ledger;

import com.flagship.liquidity_pool.asset.Asset;

import java.math.BigInteger;

/**
 * Moves asset balances between accounts on behalf of the pool.
 *
 * The pool holds all reserves in a single account, {@link #poolAccount()}.
 * Implementations may call back into the engine from inside a transfer; the
 * engine guards against that.
 */
public interface TokenLedger {

    /**
     * The account that holds pool reserves and spends allowances.
     */
    String poolAccount();

    /**
     * Total issued supply of an asset.
     *
     * @throws LedgerException UNKNOWN_ASSET if the ledger does not know the asset
     */
    BigInteger totalSupply(Asset asset);

    /**
     * Moves amount from one account to another using the allowance the
     * source granted to the pool account.
     *
     * @throws LedgerException INSUFFICIENT_BALANCE or INSUFFICIENT_ALLOWANCE
     */
    void transferFrom(Asset asset, String from, String to, BigInteger amount);

    /**
     * Moves amount out of the pool account.
     *
     * @throws LedgerException INSUFFICIENT_BALANCE
     */
    void transfer(Asset asset, String to, BigInteger amount);

    /**
     * Undoes an earlier {@link #transferFrom}: moves amount from to back to
     * from and restores the allowance the original pull consumed.
     *
     * @throws LedgerException INSUFFICIENT_BALANCE if to no longer holds amount
     */
    void reverseTransferFrom(Asset asset, String from, String to, BigInteger amount);
}
