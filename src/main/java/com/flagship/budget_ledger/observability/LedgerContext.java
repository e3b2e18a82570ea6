package com.flagship.budget_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local logging context for ledger operations.
 *
 * The correlation id flows through:
 * - every log statement of a mutation unit (via MDC)
 * - outbox events written by the unit
 * - Kafka headers of the published events
 *
 * The excluded outer layer may set a correlation id before calling
 * {@code LedgerOperations}; otherwise one is generated per operation.
 */
public final class LedgerContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String BUDGET_ID_MDC_KEY = "budgetId";
    public static final String OPERATION_MDC_KEY = "operation";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private LedgerContext() {
        // Utility class
    }

    /**
     * Gets the current correlation id, generating one if none is set.
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
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Opens the logging scope of one operation. Close it in a finally block or use
     * try-with-resources.
     */
    public static Scope open(String operation, UUID budgetId) {
        boolean ownsCorrelationId = !hasCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, getCorrelationId());
        MDC.put(OPERATION_MDC_KEY, operation);
        if (budgetId != null) {
            MDC.put(BUDGET_ID_MDC_KEY, budgetId.toString());
        }
        return new Scope(ownsCorrelationId);
    }

    /**
     * Short form keeps log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static final class Scope implements AutoCloseable {

        private final boolean ownsCorrelationId;

        private Scope(boolean ownsCorrelationId) {
            this.ownsCorrelationId = ownsCorrelationId;
        }

        @Override
        public void close() {
            MDC.remove(OPERATION_MDC_KEY);
            MDC.remove(BUDGET_ID_MDC_KEY);
            if (ownsCorrelationId) {
                MDC.remove(CORRELATION_ID_MDC_KEY);
                correlationId.remove();
            }
        }
    }
}
