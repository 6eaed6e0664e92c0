package com.flagship.liquidity_pool.ledger;

import com.flagship.liquidity_pool.asset.Asset;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Thread-safe in-memory token ledger.
 *
 * Stands in for real per-asset adapters in local runs and tests. Keeps
 * balances, total supply and the allowance each holder granted to the pool
 * account.
 *
 * Key invariant: for every asset, the sum of balances equals total supply.
 */
@Slf4j
public class InMemoryTokenLedger implements TokenLedger {

    private final String poolAccount;
    private final Map<Asset, BigInteger> supply = new HashMap<>();
    private final Map<Asset, Map<String, BigInteger>> balances = new HashMap<>();
    private final Map<Asset, Map<String, BigInteger>> allowances = new HashMap<>();

    public InMemoryTokenLedger(String poolAccount) {
        if (poolAccount == null || poolAccount.isBlank()) {
            throw new IllegalArgumentException("Pool account is required");
        }
        this.poolAccount = poolAccount;
    }

    @Override
    public String poolAccount() {
        return poolAccount;
    }

    /**
     * Makes an asset known to the ledger with zero supply.
     */
    public synchronized void defineAsset(Asset asset) {
        supply.putIfAbsent(asset, BigInteger.ZERO);
        balances.computeIfAbsent(asset, a -> new HashMap<>());
        allowances.computeIfAbsent(asset, a -> new HashMap<>());
    }

    /**
     * Issues new units of an asset to an account, defining the asset if needed.
     */
    public synchronized void mint(Asset asset, String account, BigInteger amount) {
        requirePositive(amount);
        defineAsset(asset);
        supply.merge(asset, amount, BigInteger::add);
        balances.get(asset).merge(account, amount, BigInteger::add);
        log.debug("Minted {} {} to {}", amount, asset, account);
    }

    /**
     * Sets the allowance the holder grants to the pool account.
     */
    public synchronized void approve(Asset asset, String holder, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Allowance must not be negative");
        }
        requireKnown(asset);
        allowances.get(asset).put(holder, amount);
    }

    public synchronized BigInteger balanceOf(Asset asset, String account) {
        Map<String, BigInteger> assetBalances = balances.get(asset);
        return assetBalances == null ? BigInteger.ZERO : assetBalances.getOrDefault(account, BigInteger.ZERO);
    }

    public synchronized BigInteger allowance(Asset asset, String holder) {
        Map<String, BigInteger> assetAllowances = allowances.get(asset);
        return assetAllowances == null ? BigInteger.ZERO : assetAllowances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger totalSupply(Asset asset) {
        requireKnown(asset);
        return supply.get(asset);
    }

    @Override
    public synchronized void transferFrom(Asset asset, String from, String to, BigInteger amount) {
        requirePositive(amount);
        requireKnown(asset);

        BigInteger allowed = allowance(asset, from);
        if (allowed.compareTo(amount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_ALLOWANCE,
                    String.format("Allowance of %s for %s is %s, need %s", from, asset, allowed, amount));
        }
        move(asset, from, to, amount);
        allowances.get(asset).put(from, allowed.subtract(amount));
    }

    @Override
    public synchronized void transfer(Asset asset, String to, BigInteger amount) {
        requirePositive(amount);
        requireKnown(asset);
        move(asset, poolAccount, to, amount);
    }

    @Override
    public synchronized void reverseTransferFrom(Asset asset, String from, String to, BigInteger amount) {
        requirePositive(amount);
        requireKnown(asset);
        move(asset, to, from, amount);
        allowances.get(asset).merge(from, amount, BigInteger::add);
    }

    private void move(Asset asset, String from, String to, BigInteger amount) {
        Map<String, BigInteger> assetBalances = balances.get(asset);
        BigInteger available = assetBalances.getOrDefault(from, BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                    String.format("Balance of %s in %s is %s, need %s", from, asset, available, amount));
        }
        assetBalances.put(from, available.subtract(amount));
        assetBalances.merge(to, amount, BigInteger::add);
        log.debug("Moved {} {} from {} to {}", amount, asset, from, to);
    }

    private void requireKnown(Asset asset) {
        if (!supply.containsKey(asset)) {
            throw new LedgerException(LedgerError.UNKNOWN_ASSET, "Unknown asset: " + asset);
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
