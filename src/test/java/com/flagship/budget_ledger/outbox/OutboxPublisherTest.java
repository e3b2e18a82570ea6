package com.flagship.budget_ledger.outbox;

import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Publisher behavior against a mocked Kafka template: records are keyed by aggregate,
 * carry the event headers, and only acknowledged sends are marked published.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, String>> recordCaptor;

    private OutboxPublisher publisher;
    private LedgerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics, properties);
    }

    private static OutboxEvent event(String correlationId) {
        return OutboxEvent.create(UUID.randomUUID(), "Goal", UUID.randomUUID(), "GoalReservationChanged",
            "{\"amount\":100}", correlationId);
    }

    private static ProducerRecord<String, String> anyRecord() {
        return ArgumentMatchers.any();
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Sends keyed records with headers and marks them published")
    void publishesPendingEvents() {
        OutboxEvent event = event("abc12345");
        when(outboxService.findUnpublishedEvents(5, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyRecord()))
            .thenAnswer(invocation -> acknowledged(invocation.getArgument(0)));

        publisher.triggerPublish();

        verify(kafkaTemplate).send(recordCaptor.capture());
        ProducerRecord<String, String> record = recordCaptor.getValue();
        assertEquals("ledger-events", record.topic());
        assertEquals(event.getAggregateId().toString(), record.key());
        assertEquals(event.getPayload(), record.value());
        assertEquals("GoalReservationChanged",
            new String(record.headers().lastHeader("eventType").value(), StandardCharsets.UTF_8));
        assertEquals("abc12345",
            new String(record.headers().lastHeader("correlationId").value(), StandardCharsets.UTF_8));

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("GoalReservationChanged");
    }

    @Test
    @DisplayName("A failed send leaves the event in the outbox with a bumped retry count")
    void failedSendIsRecorded() {
        OutboxEvent event = event(null);
        when(outboxService.findUnpublishedEvents(5, 100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyRecord()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("GoalReservationChanged");
    }

    @Test
    void idleWhenNothingIsPending() {
        when(outboxService.findUnpublishedEvents(5, 100)).thenReturn(List.of());

        publisher.triggerPublish();

        verifyNoInteractions(kafkaTemplate);
    }
}
