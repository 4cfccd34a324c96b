package com.flagship.token_wallet.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the billing code logs under.
 *
 * The correlation id flows from the X-Correlation-ID header (or is generated)
 * into every log line of the request, and from Kafka usage events into the
 * listener thread.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SESSION_ID_MDC_KEY = "sessionId";
    public static final String WALLET_ID_MDC_KEY = "walletId";
    public static final String ESCROW_ID_MDC_KEY = "escrowId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Sets the id for this thread and mirrors it into the MDC. Blank ids are replaced.
     */
    public static String begin(String id) {
        String effective = (id != null && !id.isBlank()) ? id : generateCorrelationId();
        correlationId.set(effective);
        MDC.put(CORRELATION_ID_MDC_KEY, effective);
        return effective;
    }

    /**
     * Clears the thread-local and every billing MDC key.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(SESSION_ID_MDC_KEY);
        MDC.remove(WALLET_ID_MDC_KEY);
        MDC.remove(ESCROW_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
