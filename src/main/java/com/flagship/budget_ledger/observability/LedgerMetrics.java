package com.flagship.budget_ledger.observability;

import com.flagship.budget_ledger.error.LedgerErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger mutations.
 *
 * Metrics exposed:
 * - ledger.mutations: units by operation and outcome (committed or the failure kind)
 * - ledger.mutation.duration: wall time of a unit, retries included
 * - ledger.conflicts.retried: units re-run after a lock or version conflict
 * - ledger.idempotency: replayed vs. new keyed requests
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter conflictsRetried;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.conflictsRetried = Counter.builder("ledger.conflicts.retried")
                .description("Mutation units retried after a concurrency conflict")
                .register(registry);
    }

    public void recordCommitted(String operation, Duration duration) {
        registry.counter("ledger.mutations",
                "operation", sanitizeTag(operation),
                "outcome", "committed"
        ).increment();
        timer(operation).record(duration);
    }

    public void recordFailed(String operation, LedgerErrorKind kind, Duration duration) {
        registry.counter("ledger.mutations",
                "operation", sanitizeTag(operation),
                "outcome", kind.name().toLowerCase()
        ).increment();
        timer(operation).record(duration);
    }

    public void recordConflictRetry() {
        conflictsRetried.increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    private Timer timer(String operation) {
        return Timer.builder("ledger.mutation.duration")
                .description("Time taken by a mutation unit")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Keeps tag values to a bounded alphabet and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
