package com.flagship.license_fulfillment.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the services tag logs with.
 *
 * HTTP requests get their id from {@link CorrelationIdFilter}; scheduled work
 * (crypto polls, sweeps) opens its own scope with {@link #begin(String)}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";
    public static final String USER_ID_MDC_KEY = "userId";

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

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    /**
     * Starts a fresh correlation scope on the current thread with a prefixed id,
     * e.g. {@code poll-1a2b3c4d}. Pair with {@link #clear()} in a finally block.
     */
    public static String begin(String prefix) {
        String id = prefix + "-" + generateCorrelationId();
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static void tagPayment(Object paymentId, String userId) {
        if (paymentId != null) {
            MDC.put(PAYMENT_ID_MDC_KEY, paymentId.toString());
        }
        if (userId != null) {
            MDC.put(USER_ID_MDC_KEY, userId);
        }
    }

    /**
     * Clears the thread-local id and every MDC key owned by this class.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(PAYMENT_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
