package com.flagship.settlement_engine.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by every log line, and the correlation scope helpers.
 *
 * HTTP requests get their id from {@link CorrelationIdFilter}. Scheduled
 * workers have no inbound request and open a fresh scope per pass.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ORDER_ID_MDC_KEY = "orderId";
    public static final String EVENT_ID_MDC_KEY = "eventId";
    public static final String BENEFICIARY_ID_MDC_KEY = "beneficiaryId";

    private static final int SHORT_ID_LENGTH = 8;

    private CorrelationContext() {
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Binds {@code candidate} (or a new id when it is blank) to the current
     * thread and returns the id in effect.
     */
    public static String open(String candidate) {
        String id = candidate == null || candidate.isBlank() ? newCorrelationId() : candidate;
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static String openBackground() {
        return open(null);
    }

    /** Removes every key this class owns, including the per-entity ones. */
    public static void close() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ORDER_ID_MDC_KEY);
        MDC.remove(EVENT_ID_MDC_KEY);
        MDC.remove(BENEFICIARY_ID_MDC_KEY);
    }
}
