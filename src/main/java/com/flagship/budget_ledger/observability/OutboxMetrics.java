package com.flagship.budget_ledger.observability;

import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox health gauges: backlog size, age of the oldest pending event, and events
 * that exhausted their retries. Values are cached and refreshed by
 * {@link MetricsScheduler} so a scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final LedgerProperties properties;
    private final Clock clock;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.outbox.backlog", backlogSize, AtomicLong::get)
                .description("Number of unpublished ledger events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("ledger.outbox.oldest.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished ledger event in seconds")
                .register(meterRegistry);

        Gauge.builder("ledger.outbox.dead", failedEventCount, AtomicLong::get)
                .description("Ledger events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, clock.instant()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            long failed = outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(
                    properties.getOutbox().getMaxRetries());
            failedEventCount.set(failed);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestEventAgeSeconds.get(), failed);
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        recordSend(eventType, "success");
    }

    public void recordEventPublishFailed(String eventType) {
        recordSend(eventType, "failure");
    }

    private void recordSend(String eventType, String outcome) {
        meterRegistry.counter("ledger.outbox.sends", "event_type", eventType, "outcome", outcome).increment();
    }
}
