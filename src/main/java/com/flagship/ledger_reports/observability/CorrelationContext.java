package com.flagship.ledger_reports.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across report requests.
 *
 * The id comes from the {@code X-Correlation-ID} header when the caller sends
 * one and is generated otherwise; it is echoed back on the response and
 * stamped on every log line of the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String COMPANY_ID_MDC_KEY = "companyId";
    public static final String LEDGER_NAME_MDC_KEY = "ledgerName";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id, generated on first use when none was set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short ids keep log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
