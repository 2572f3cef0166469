package com.odin.share_relay_service.utility;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

public class CorrelationIdUtil {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String PRINCIPAL_KEY = "principal";

    // Get the correlation ID from MDC
    public static String getCorrelationId() {
        return MDC.get(CORRELATION_ID_HEADER);
    }

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_HEADER, correlationId);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Start the log context of one inbound frame or request.
     */
    public static void begin(String principalId) {
        setCorrelationId(generateCorrelationId());
        if (principalId != null) {
            MDC.put(PRINCIPAL_KEY, principalId);
        }
    }

    /**
     * Wrap a task so it runs with the MDC of the submitting thread.
     */
    public static Runnable propagate(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_HEADER);
        MDC.remove(PRINCIPAL_KEY);
    }
}
