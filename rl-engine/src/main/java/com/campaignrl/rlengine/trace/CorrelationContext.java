package com.campaignrl.rlengine.trace;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id handling for reactive pipelines.
 *
 * <p>The id travels explicitly with each request and experience; MDC is only written for
 * the duration of a single log statement via {@link #withMdc}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_KEY = "correlationId";

    private CorrelationContext() {}

    /** The caller's id, or a fresh one when the caller sent none. */
    public static String orNew(String correlationId) {
        return correlationId != null && !correlationId.isBlank() ? correlationId : UUID.randomUUID().toString();
    }

    public static void withMdc(String correlationId, Runnable logAction) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
        try {
            logAction.run();
        } finally {
            MDC.remove(CORRELATION_ID_KEY);
        }
    }
}
