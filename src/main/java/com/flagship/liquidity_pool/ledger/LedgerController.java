package com.flagship.liquidity_pool.ledger;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.ledger.dto.ApproveRequest;
import com.flagship.liquidity_pool.ledger.dto.BalanceResponse;
import com.flagship.liquidity_pool.ledger.dto.MintRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Helper endpoints for the in-memory ledger, so a local instance can be
 * funded and exercised over HTTP.
 */
@RestController
@RequestMapping("/api/ledger")
@ConditionalOnProperty(name = "pool.ledger.in-memory.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final InMemoryTokenLedger ledger;

    @PostMapping("/mint")
    public BalanceResponse mint(@Valid @RequestBody MintRequest request) {
        Asset asset = Asset.of(request.getAsset());
        ledger.mint(asset, request.getAccount(), request.getAmount());
        log.info("Minted {} {} to {}", request.getAmount(), asset, request.getAccount());
        return balance(request.getAccount(), asset.getId()).getBody();
    }

    @PostMapping("/approve")
    public BalanceResponse approve(@Valid @RequestBody ApproveRequest request) {
        Asset asset = Asset.of(request.getAsset());
        ledger.approve(asset, request.getHolder(), request.getAmount());
        log.info("Allowance of {} for {} set to {}", request.getHolder(), asset, request.getAmount());
        return balance(request.getHolder(), asset.getId()).getBody();
    }

    @GetMapping("/balances/{account}/{asset}")
    public ResponseEntity<BalanceResponse> balance(@PathVariable("account") String account,
                                                   @PathVariable("asset") String assetId) {
        Asset asset = Asset.of(assetId);
        return ResponseEntity.ok(BalanceResponse.builder()
            .asset(asset.getId())
            .account(account)
            .balance(ledger.balanceOf(asset, account))
            .allowance(ledger.allowance(asset, account))
            .build());
    }
}
