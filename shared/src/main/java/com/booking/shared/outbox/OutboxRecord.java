package com.booking.shared.outbox;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Outbox record: persisted alongside aggregate state in the same transaction.
 *
 *   1. BEGIN TRANSACTION
 *      UPDATE appointments ... WHERE row_version = :stored   -- aggregate state
 *      INSERT INTO outbox (...)                              -- one row per drained event
 *   2. COMMIT
 *   3. Relay reads outbox, publishes to Kafka, marks published
 *
 * Either both the aggregate change and its events are committed, or neither is.
 */
@Entity
@Table(name = "outbox", indexes = {
    @Index(name = "idx_outbox_unpublished",
           columnList = "published_at, retry_count, created_at"),
    @Index(name = "idx_outbox_aggregate",
           columnList = "aggregate_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxRecord {

    /** Same UUID as the event id */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    /** Partition key of the event (organization id or place id) */
    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    /** CloudEvents source, e.g. /appointments */
    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "subject", length = 100)
    private String subject;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "event_time", nullable = false)
    private Instant eventTime;

    @Column(name = "topic", nullable = false, length = 200)
    private String topic;

    /** Serialized event JSON */
    @Column(name = "payload", nullable = false, length = 65535)
    private String payload;

    /** NULL until successfully published to Kafka */
    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    /** Relay skips records where nextRetryAt > now */
    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onPrePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onPreUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isExhausted(int maxRetries) {
        return retryCount >= maxRetries;
    }

    public void markPublished() {
        this.publishedAt = Instant.now();
        this.nextRetryAt = null;
        this.updatedAt = publishedAt;
    }

    /** Record a failure and schedule the next attempt: 5s, 10s, 20s, 40s, 80s */
    public void recordFailure(String errorMessage) {
        this.retryCount++;
        this.lastError = errorMessage != null && errorMessage.length() > 1000
                ? errorMessage.substring(0, 1000) : errorMessage;
        long backoffSeconds = (1L << (retryCount - 1)) * 5L;
        this.nextRetryAt = Instant.now().plusSeconds(backoffSeconds);
        this.updatedAt = Instant.now();
    }
}
