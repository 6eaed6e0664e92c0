package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.observability.CorrelationContext;
import com.flagship.liquidity_pool.pool.dto.CreatePairRequest;
import com.flagship.liquidity_pool.pool.dto.PairResponse;
import com.flagship.liquidity_pool.pool.dto.QuoteResponse;
import com.flagship.liquidity_pool.pool.dto.RegisterAssetRequest;
import com.flagship.liquidity_pool.pool.dto.SwapRequest;
import com.flagship.liquidity_pool.pool.dto.SwapResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * REST controller for pool operations.
 *
 * State-changing endpoints act for the account named in the X-Account-Id
 * header. Errors are mapped by the global exception handler.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class PoolController {

    private final SwapExecutor swapExecutor;
    private final PairStore pairStore;

    @PostMapping("/assets")
    public ResponseEntity<Void> registerAsset(@Valid @RequestBody RegisterAssetRequest request) {
        log.info("Received asset registration request: asset={}", request.getAsset());
        swapExecutor.registerAsset(Asset.of(request.getAsset()));
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping("/assets")
    public List<String> registeredAssets() {
        return pairStore.registeredAssets().stream()
            .map(Asset::getId)
            .toList();
    }

    @PostMapping("/pairs")
    public ResponseEntity<PairResponse> createPair(
            @Valid @RequestBody CreatePairRequest request,
            @RequestHeader(CorrelationContext.ACCOUNT_ID_HEADER) String accountId) {

        CorrelationContext.bindAccount(accountId);
        log.info("Received pair creation request: assetA={}, assetB={}, amountA={}, amountB={}",
                request.getAssetA(), request.getAssetB(), request.getAmountA(), request.getAmountB());

        Pair pair = swapExecutor.createPair(accountId,
                Asset.of(request.getAssetA()), Asset.of(request.getAssetB()),
                request.getAmountA(), request.getAmountB());

        return ResponseEntity.status(HttpStatus.CREATED).body(PairResponse.from(pair));
    }

    @GetMapping("/pairs")
    public List<PairResponse> pairs() {
        return pairStore.pairs().stream()
            .map(PairResponse::from)
            .toList();
    }

    /**
     * Looks up a pair; the two assets may be given in either order.
     */
    @GetMapping("/pairs/{assetA}/{assetB}")
    public PairResponse getPair(@PathVariable("assetA") String assetA, @PathVariable("assetB") String assetB) {
        return PairResponse.from(pairStore.lookup(Asset.of(assetA), Asset.of(assetB)));
    }

    @GetMapping("/pairs/{assetA}/{assetB}/quote")
    public QuoteResponse quote(@PathVariable("assetA") String assetA,
                               @PathVariable("assetB") String assetB,
                               @RequestParam("asset_in") String assetIn,
                               @RequestParam("amount_in") BigInteger amountIn) {
        Asset in = Asset.of(assetIn);
        Asset a = Asset.of(assetA);
        Asset b = Asset.of(assetB);
        if (!in.equals(a) && !in.equals(b)) {
            throw new IllegalArgumentException("asset_in must be one of " + a + ", " + b);
        }
        Asset out = in.equals(a) ? b : a;

        BigInteger amountOut = swapExecutor.quote(in, out, amountIn);
        return QuoteResponse.builder()
            .assetIn(in.getId())
            .assetOut(out.getId())
            .amountIn(amountIn)
            .amountOut(amountOut)
            .feeNumerator(swapExecutor.getFeeNumerator())
            .feeDenominator(swapExecutor.getFeeDenominator())
            .build();
    }

    @PostMapping("/swaps")
    public SwapResponse swap(
            @Valid @RequestBody SwapRequest request,
            @RequestHeader(CorrelationContext.ACCOUNT_ID_HEADER) String accountId) {

        CorrelationContext.bindAccount(accountId);
        log.info("Received swap request: assetIn={}, assetOut={}, amountIn={}",
                request.getAssetIn(), request.getAssetOut(), request.getAmountIn());

        SwapResult result = swapExecutor.swap(accountId,
                Asset.of(request.getAssetIn()), Asset.of(request.getAssetOut()), request.getAmountIn());
        return SwapResponse.from(result);
    }
}
