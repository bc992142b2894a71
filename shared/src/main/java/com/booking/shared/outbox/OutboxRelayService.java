package com.booking.shared.outbox;

import com.booking.shared.kafka.EventEnvelope;
import com.booking.shared.kafka.KafkaEventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Outbox Relay: polls the outbox table and publishes to Kafka.
 *
 * Runs one second after the previous poll finished and handles up to {@code booking.outbox.batch-size}
 * records. A failed record is retried with exponential backoff until {@code booking.outbox.max-retries}
 * is reached; exhausted records stay in the table with their last error.
 *
 * Delivery is at least once: a crash after the broker acknowledged but before the commit publishes
 * the record again, which consumers absorb through the event id.
 */
@Slf4j
@Service
@EnableConfigurationProperties(OutboxProperties.class)
@ConditionalOnProperty(name = "booking.events.delivery", havingValue = "outbox", matchIfMissing = true)
public class OutboxRelayService {

    private final OutboxRepository outboxRepository;
    private final KafkaEventPublisher kafkaEventPublisher;
    private final OutboxProperties properties;
    private final Counter relayedCounter;
    private final Counter relayErrorCounter;

    public OutboxRelayService(OutboxRepository outboxRepository,
                              KafkaEventPublisher kafkaEventPublisher,
                              OutboxProperties properties,
                              MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.kafkaEventPublisher = kafkaEventPublisher;
        this.properties = properties;
        this.relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to Kafka")
                .register(meterRegistry);
        this.relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Errors during outbox relay")
                .register(meterRegistry);
    }

    /**
     * @return number of records published in this poll
     */
    @Scheduled(fixedDelayString = "${booking.outbox.fixed-delay-ms:1000}")
    @Transactional
    public int relay() {
        List<OutboxRecord> records = outboxRepository.findUnpublishedForRelay(
                Instant.now(), properties.getMaxRetries(), properties.getBatchSize());

        if (records.isEmpty()) return 0;

        log.debug("Outbox relay: processing {} records", records.size());

        int published = 0;
        for (OutboxRecord record : records) {
            try {
                kafkaEventPublisher.send(toEnvelope(record));
                record.markPublished();
                relayedCounter.increment();
                published++;
            } catch (RuntimeException ex) {
                record.recordFailure(ex.getMessage());
                relayErrorCounter.increment();
                if (record.isExhausted(properties.getMaxRetries())) {
                    log.error("Outbox record exhausted its retries: id={}, eventType={}, attempts={}",
                            record.getId(), record.getEventType(), record.getRetryCount(), ex);
                } else {
                    log.warn("Failed to relay outbox record: id={}, eventType={}, attempt={}, nextRetryAt={}",
                            record.getId(), record.getEventType(), record.getRetryCount(), record.getNextRetryAt());
                }
            }
        }

        outboxRepository.saveAll(records);
        return published;
    }

    private static EventEnvelope toEnvelope(OutboxRecord record) {
        return EventEnvelope.builder()
                .topic(record.getTopic())
                .key(record.getAggregateId())
                .eventId(record.getId())
                .type(record.getEventType())
                .source(record.getAggregateType())
                .subject(record.getSubject())
                .time(record.getEventTime())
                .payload(record.getPayload())
                .build();
    }
}
