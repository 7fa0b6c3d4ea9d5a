package com.volunteersinc.payment_settlement.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id of the unit of work running on the current thread, and
 * the MDC keys the service logs with.
 *
 * A unit of work is either an HTTP request or one replayed outbox event.
 * Replays reuse the id of the confirmation that failed, so both attempts
 * can be found under one id.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String SUBSCRIPTION_ID_MDC_KEY = "subscriptionId";

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Starts a unit of work under {@code candidate}, or under a fresh id
     * when it is blank. Must be paired with {@link #end()}.
     *
     * @return the id now in effect
     */
    public static String begin(String candidate) {
        String id = candidate == null || candidate.isBlank() ? generateCorrelationId() : candidate.trim();
        CURRENT.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Clears the id and every record-scoped MDC key.
     */
    public static void end() {
        CURRENT.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
        MDC.remove(SUBSCRIPTION_ID_MDC_KEY);
    }

    /**
     * The id in effect, generating one for work started outside
     * {@link #begin(String)} such as scheduled jobs.
     */
    public static String getCorrelationId() {
        String id = CURRENT.get();
        if (id == null) {
            id = generateCorrelationId();
            CURRENT.set(id);
        }
        return id;
    }

    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
