package com.flagship.liquidity_pool.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Logging context of a pool request, kept in the SLF4J MDC.
 *
 * Three keys are tracked:
 * - correlationId: one per HTTP request, from X-Correlation-ID or generated
 * - accountId: the caller named in X-Account-Id
 * - pair: the canonical pair a swap is running against
 *
 * {@link CorrelationIdFilter} opens and closes the context around each
 * request; controllers and the swap executor bind the other two keys.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String ACCOUNT_ID_HEADER = "X-Account-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String PAIR_MDC_KEY = "pair";

    private static final int CORRELATION_ID_LENGTH = 8;

    private CorrelationContext() {
    }

    /**
     * Starts the context of a request.
     *
     * @param requestedId correlation id sent by the client, may be null or blank
     * @return the correlation id in effect, echoed back to the client
     */
    public static String begin(String requestedId) {
        String id = requestedId != null && !requestedId.isBlank()
                ? requestedId.trim()
                : UUID.randomUUID().toString().substring(0, CORRELATION_ID_LENGTH);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static String correlationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void bindAccount(String accountId) {
        MDC.put(ACCOUNT_ID_MDC_KEY, accountId);
    }

    public static void bindPair(String pairKey) {
        MDC.put(PAIR_MDC_KEY, pairKey);
    }

    public static void unbindPair() {
        MDC.remove(PAIR_MDC_KEY);
    }

    /**
     * Removes every key this context owns; called when the request ends.
     */
    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ACCOUNT_ID_MDC_KEY);
        MDC.remove(PAIR_MDC_KEY);
    }
}
