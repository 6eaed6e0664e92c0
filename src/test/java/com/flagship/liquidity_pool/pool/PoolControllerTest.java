package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.config.JacksonConfig;
import com.flagship.liquidity_pool.ledger.LedgerError;
import com.flagship.liquidity_pool.ledger.LedgerException;
import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for the pool API: request binding and error status mapping.
 */
@WebMvcTest(PoolController.class)
@Import(JacksonConfig.class)
@DisplayName("Pool Controller Tests")
class PoolControllerTest {

    private static final Asset X = Asset.of("X");
    private static final Asset Y = Asset.of("Y");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SwapExecutor swapExecutor;

    @MockBean
    private PairStore pairStore;

    private static Pair pair(long low, long high) {
        return Pair.create(PairKey.canonicalize(X, Y), X, BigInteger.valueOf(low), BigInteger.valueOf(high));
    }

    @Test
    @DisplayName("POST /api/assets returns 201")
    void testRegisterAsset() throws Exception {
        mockMvc.perform(post("/api/assets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset\":\"X\"}"))
            .andExpect(status().isCreated());

        verify(swapExecutor).registerAsset(X);
    }

    @Test
    @DisplayName("Duplicate asset maps to 409 with the error code")
    void testRegisterDuplicateAsset() throws Exception {
        doThrow(PoolException.of(PoolError.DUPLICATE_ASSET, "Asset already registered: %s", X))
            .when(swapExecutor).registerAsset(X);

        mockMvc.perform(post("/api/assets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset\":\"X\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("DUPLICATE_ASSET"));
    }

    @Test
    @DisplayName("POST /api/pairs creates the pair for the header account")
    void testCreatePair() throws Exception {
        when(swapExecutor.createPair(eq("alice"), eq(Y), eq(X), eq(BigInteger.valueOf(2000)), eq(BigInteger.valueOf(1000))))
            .thenReturn(pair(1000, 2000));

        mockMvc.perform(post("/api/pairs")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_a\":\"Y\",\"asset_b\":\"X\",\"amount_a\":2000,\"amount_b\":\"1000\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.asset_low").value("X"))
            .andExpect(jsonPath("$.asset_high").value("Y"))
            .andExpect(jsonPath("$.reserve_low").value("1000"))
            .andExpect(jsonPath("$.reserve_high").value("2000"));
    }

    @Test
    @DisplayName("Missing account header is rejected before the pool is called")
    void testCreatePairWithoutAccount() throws Exception {
        mockMvc.perform(post("/api/pairs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_a\":\"X\",\"asset_b\":\"Y\",\"amount_a\":1000,\"amount_b\":2000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));

        verifyNoInteractions(swapExecutor);
    }

    @Test
    @DisplayName("Missing request fields fail validation")
    void testCreatePairValidation() throws Exception {
        mockMvc.perform(post("/api/pairs")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_a\":\"X\",\"amount_a\":1000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.assetB").exists())
            .andExpect(jsonPath("$.details.amountB").exists());
    }

    @Test
    @DisplayName("Existing pair maps to 409")
    void testCreatePairAlreadyExists() throws Exception {
        when(swapExecutor.createPair(anyString(), any(), any(), any(), any()))
            .thenThrow(PoolException.of(PoolError.PAIR_ALREADY_EXISTS, "Pair already exists: %s", "X/Y"));

        mockMvc.perform(post("/api/pairs")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_a\":\"X\",\"asset_b\":\"Y\",\"amount_a\":1000,\"amount_b\":2000}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("PAIR_ALREADY_EXISTS"));
    }

    @Test
    @DisplayName("GET of an unknown pair maps to 404")
    void testGetPairNotFound() throws Exception {
        when(pairStore.lookup(X, Y)).thenThrow(PoolException.of(PoolError.PAIR_NOT_FOUND, "No pair for %s/%s", X, Y));

        mockMvc.perform(get("/api/pairs/X/Y"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("PAIR_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/pairs lists pairs")
    void testListPairs() throws Exception {
        when(pairStore.pairs()).thenReturn(List.of(pair(1000, 2000)));

        mockMvc.perform(get("/api/pairs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].asset_low").value("X"))
            .andExpect(jsonPath("$[0].reserve_high").value("2000"));
    }

    @Test
    @DisplayName("Quote resolves the output asset from the path")
    void testQuote() throws Exception {
        when(swapExecutor.quote(Y, X, BigInteger.valueOf(100))).thenReturn(BigInteger.valueOf(47));
        when(swapExecutor.getFeeNumerator()).thenReturn(3L);
        when(swapExecutor.getFeeDenominator()).thenReturn(1000L);

        mockMvc.perform(get("/api/pairs/X/Y/quote")
                .param("asset_in", "Y")
                .param("amount_in", "100"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.asset_out").value("X"))
            .andExpect(jsonPath("$.amount_out").value("47"))
            .andExpect(jsonPath("$.fee_denominator").value(1000));
    }

    @Test
    @DisplayName("Quote for an asset outside the pair is a bad request")
    void testQuoteForeignAsset() throws Exception {
        mockMvc.perform(get("/api/pairs/X/Y/quote")
                .param("asset_in", "Z")
                .param("amount_in", "100"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"));
    }

    @Test
    @DisplayName("POST /api/swaps returns the swap outcome")
    void testSwap() throws Exception {
        Pair after = pair(1100, 1819);
        when(swapExecutor.swap("alice", X, Y, BigInteger.valueOf(100)))
            .thenReturn(new SwapResult(X, Y, BigInteger.valueOf(100), BigInteger.valueOf(181), after));

        mockMvc.perform(post("/api/swaps")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_in\":\"X\",\"asset_out\":\"Y\",\"amount_in\":100}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.amount_out").value("181"))
            .andExpect(jsonPath("$.pair.reserve_low").value("1100"))
            .andExpect(jsonPath("$.pair.reserve_high").value("1819"));
    }

    @Test
    @DisplayName("Pool validation errors on swap map to 400")
    void testSwapInsufficientOutput() throws Exception {
        when(swapExecutor.swap(anyString(), any(), any(), any()))
            .thenThrow(PoolException.of(PoolError.INSUFFICIENT_OUTPUT, "Output rounds to zero"));

        mockMvc.perform(post("/api/swaps")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_in\":\"Y\",\"asset_out\":\"X\",\"amount_in\":1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_OUTPUT"));
    }

    @Test
    @DisplayName("Ledger refusals map to 422")
    void testSwapLedgerRefusal() throws Exception {
        when(swapExecutor.swap(anyString(), any(), any(), any()))
            .thenThrow(new LedgerException(LedgerError.INSUFFICIENT_ALLOWANCE, "Allowance too low"));

        mockMvc.perform(post("/api/swaps")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_in\":\"X\",\"asset_out\":\"Y\",\"amount_in\":100}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_ALLOWANCE"));
    }

    @Test
    @DisplayName("Reentrancy maps to 409 and invariant failures to 500")
    void testConcurrencyAndInternalErrors() throws Exception {
        when(swapExecutor.swap(anyString(), any(), any(), any()))
            .thenThrow(PoolException.of(PoolError.REENTRANCY_VIOLATION, "re-entered"))
            .thenThrow(PoolException.of(PoolError.INVARIANT_VIOLATION, "product decreased"));
        String body = "{\"asset_in\":\"X\",\"asset_out\":\"Y\",\"amount_in\":100}";

        mockMvc.perform(post("/api/swaps")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/swaps")
                .header("X-Account-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("INVARIANT_VIOLATION"));
    }
}
