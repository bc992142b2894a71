package com.booking.shared.outbox;

import com.booking.shared.error.EventPublishException;
import com.booking.shared.kafka.EventEnvelope;
import com.booking.shared.kafka.KafkaEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxRelayServiceTest {

    @Mock OutboxRepository outboxRepository;
    @Mock KafkaEventPublisher kafkaEventPublisher;

    SimpleMeterRegistry meterRegistry;
    OutboxProperties properties;
    OutboxRelayService relay;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new OutboxProperties();
        properties.setBatchSize(10);
        properties.setMaxRetries(3);
        relay = new OutboxRelayService(outboxRepository, kafkaEventPublisher, properties, meterRegistry);
    }

    private static OutboxRecord pending(String id, int retryCount) {
        return OutboxRecord.builder()
                .id(id)
                .aggregateId("place-1")
                .aggregateType("/appointments")
                .subject("appt-1")
                .eventType("appointments.scheduled")
                .eventTime(Instant.parse("2024-06-01T08:00:00Z"))
                .topic("appointments.scheduled")
                .payload("{\"id\":\"" + id + "\"}")
                .retryCount(retryCount)
                .build();
    }

    @Test
    @DisplayName("relay: publishes the batch and marks each record published")
    void publishesBatch() {
        OutboxRecord first = pending("e-1", 0);
        OutboxRecord second = pending("e-2", 0);
        when(outboxRepository.findUnpublishedForRelay(any(Instant.class), eq(3), eq(10)))
                .thenReturn(List.of(first, second));

        int published = relay.relay();

        assertThat(published).isEqualTo(2);
        assertThat(first.isPublished()).isTrue();
        assertThat(second.isPublished()).isTrue();
        ArgumentCaptor<EventEnvelope> captor = ArgumentCaptor.forClass(EventEnvelope.class);
        verify(kafkaEventPublisher, times(2)).send(captor.capture());
        EventEnvelope envelope = captor.getAllValues().get(0);
        assertThat(envelope.getTopic()).isEqualTo("appointments.scheduled");
        assertThat(envelope.getKey()).isEqualTo("place-1");
        assertThat(envelope.getEventId()).isEqualTo("e-1");
        assertThat(envelope.getSource()).isEqualTo("/appointments");
        assertThat(envelope.getSubject()).isEqualTo("appt-1");
        assertThat(envelope.getPayload()).isEqualTo("{\"id\":\"e-1\"}");
        verify(outboxRepository).saveAll(List.of(first, second));
        assertThat(meterRegistry.get("outbox.records.relayed").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("relay: a failed record backs off, the rest of the batch still goes out")
    void failureBacksOff() {
        OutboxRecord failing = pending("e-1", 0);
        OutboxRecord healthy = pending("e-2", 0);
        when(outboxRepository.findUnpublishedForRelay(any(Instant.class), anyInt(), anyInt()))
                .thenReturn(List.of(failing, healthy));
        doThrow(new EventPublishException("broker down", new IllegalStateException()))
                .doNothing()
                .when(kafkaEventPublisher).send(any(EventEnvelope.class));

        Instant before = Instant.now();
        int published = relay.relay();

        assertThat(published).isEqualTo(1);
        assertThat(failing.isPublished()).isFalse();
        assertThat(failing.getRetryCount()).isEqualTo(1);
        assertThat(failing.getLastError()).isEqualTo("broker down");
        assertThat(failing.getNextRetryAt()).isAfterOrEqualTo(before.plusSeconds(5));
        assertThat(healthy.isPublished()).isTrue();
        assertThat(meterRegistry.get("outbox.relay.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("recordFailure: backoff doubles per attempt")
    void backoffDoubles() {
        OutboxRecord record = pending("e-1", 2);

        Instant before = Instant.now();
        record.recordFailure("timeout");

        assertThat(record.getRetryCount()).isEqualTo(3);
        assertThat(record.getNextRetryAt()).isBetween(before.plusSeconds(20), Instant.now().plusSeconds(20));
        assertThat(record.isExhausted(3)).isTrue();
    }

    @Test
    @DisplayName("relay: nothing pending, nothing saved")
    void emptyPoll() {
        when(outboxRepository.findUnpublishedForRelay(any(Instant.class), anyInt(), anyInt())).thenReturn(List.of());

        assertThat(relay.relay()).isZero();
        verify(outboxRepository, never()).saveAll(anyList());
        verifyNoInteractions(kafkaEventPublisher);
    }
}
